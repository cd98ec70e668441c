package io.nodelogs.server.core;

public enum HttpMethod {
    GET,
    HEAD
}
