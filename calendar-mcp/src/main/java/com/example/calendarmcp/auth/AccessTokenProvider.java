package com.example.calendarmcp.auth;

@FunctionalInterface
public interface AccessTokenProvider {
    String getAccessToken();
}
