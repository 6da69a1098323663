package com.pgoutbox.domain.message;

public record UserCreated(String id) {
}
