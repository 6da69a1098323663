package com.pgoutbox.domain.message;

public record UserSubscribed(String id, String plan) {
}
