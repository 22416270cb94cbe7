package io.avscheduler.config;

public record WebServerSettings(String host, int port) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 5000;

    public WebServerSettings {
        host = host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("web_server.port out of range: " + port);
        }
    }

    public static WebServerSettings defaults() {
        return new WebServerSettings(DEFAULT_HOST, DEFAULT_PORT);
    }
}
