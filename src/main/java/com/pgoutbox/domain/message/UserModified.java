package com.pgoutbox.domain.message;

public record UserModified(String id, String name) {
}
