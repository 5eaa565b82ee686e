package com.sandcastle.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sandcastle")
public class SandcastleProperties {

    private Runtime runtime = new Runtime();
    private Git git = new Git();
    private Sandbox sandbox = new Sandbox();
    private Database database = new Database();

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Database getDatabase() { return database; }
    public void setDatabase(Database database) { this.database = database; }

    public static class Runtime {
        private String provider = "docker";
        private String dockerHost = "unix:///var/run/docker.sock";
        private String containerPrefix = "sandcastle";
        private String network;
        private String imageRegistry;
        private String imageTag = "latest";
        private String workdir = "/home/workspace";
        private String baseDomain = "localhost";
        private boolean tls = false;
        private int stopTimeoutSeconds = 10;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public String getContainerPrefix() { return containerPrefix; }
        public void setContainerPrefix(String containerPrefix) { this.containerPrefix = containerPrefix; }
        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }
        public String getImageRegistry() { return imageRegistry; }
        public void setImageRegistry(String imageRegistry) { this.imageRegistry = imageRegistry; }
        public String getImageTag() { return imageTag; }
        public void setImageTag(String imageTag) { this.imageTag = imageTag; }
        public String getWorkdir() { return workdir; }
        public void setWorkdir(String workdir) { this.workdir = workdir; }
        public String getBaseDomain() { return baseDomain; }
        public void setBaseDomain(String baseDomain) { this.baseDomain = baseDomain; }
        public boolean isTls() { return tls; }
        public void setTls(boolean tls) { this.tls = tls; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
    }

    public static class Git {
        private String reposDir = "./data/repos";
        private String defaultBranch = "main";
        private String authorName = "Sandcastle";
        private String authorEmail = "sandcastle@localhost";

        public String getReposDir() { return reposDir; }
        public void setReposDir(String reposDir) { this.reposDir = reposDir; }
        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
        public String getAuthorName() { return authorName; }
        public void setAuthorName(String authorName) { this.authorName = authorName; }
        public String getAuthorEmail() { return authorEmail; }
        public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    }

    public static class Sandbox {
        private int maxNameLength = 100;
        private int maxDescriptionLength = 500;
        private int maxCommitMessageLength = 500;
        private boolean autoStart = true;

        public int getMaxNameLength() { return maxNameLength; }
        public void setMaxNameLength(int maxNameLength) { this.maxNameLength = maxNameLength; }
        public int getMaxDescriptionLength() { return maxDescriptionLength; }
        public void setMaxDescriptionLength(int maxDescriptionLength) { this.maxDescriptionLength = maxDescriptionLength; }
        public int getMaxCommitMessageLength() { return maxCommitMessageLength; }
        public void setMaxCommitMessageLength(int maxCommitMessageLength) { this.maxCommitMessageLength = maxCommitMessageLength; }
        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
    }

    /**
     * JDBC settings. The JDBC repository is used only when {@code url} is set.
     */
    public static class Database {
        private String url;
        private String username;
        private String password;
        private int maximumPoolSize = 5;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    }
}
