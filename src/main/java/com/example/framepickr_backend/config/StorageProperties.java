package com.example.framepickr_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    /** {@code local} or {@code remote}. */
    private String backend = "local";
    private Local local = new Local();
    private Remote remote = new Remote();

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public Remote getRemote() { return remote; }
    public void setRemote(Remote remote) { this.remote = remote; }

    public static class Local {
        private String baseDir = "./data";
        private String uploadsPrefix = "uploads";
        private String publicPath = "/uploads";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

        public String getUploadsPrefix() { return uploadsPrefix; }
        public void setUploadsPrefix(String uploadsPrefix) { this.uploadsPrefix = uploadsPrefix; }

        public String getPublicPath() { return publicPath; }
        public void setPublicPath(String publicPath) { this.publicPath = publicPath; }
    }

    public static class Remote {
        private String endpoint = "https://storage.googleapis.com";
        private String bucket;
        private String publicBaseUrl = "https://storage.googleapis.com";
        private String bearerToken;
        private Duration timeout = Duration.ofSeconds(30);

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

        public String getBearerToken() { return bearerToken; }
        public void setBearerToken(String bearerToken) { this.bearerToken = bearerToken; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
