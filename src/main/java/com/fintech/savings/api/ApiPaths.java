package com.fintech.savings.api;

final class ApiPaths {

    static final String BASE = "/blackrock/challenge/v1";

    private ApiPaths() {
    }
}
