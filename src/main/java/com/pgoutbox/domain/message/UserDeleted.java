package com.pgoutbox.domain.message;

public record UserDeleted(String id) {
}
