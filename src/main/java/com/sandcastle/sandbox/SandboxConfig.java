package com.sandcastle.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.sandcastle.core.config.SandcastleProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    @Bean
    @ConditionalOnProperty(name = "sandcastle.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient(SandcastleProperties properties) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(properties.getRuntime().getDockerHost())
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ContainerIdCache containerIdCache() {
        return new ContainerIdCache();
    }

    @Bean
    @ConditionalOnProperty(name = "sandcastle.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public ContainerRuntime dockerContainerRuntime(DockerClient dockerClient,
                                                   ContainerIdCache containerIdCache,
                                                   SandcastleProperties properties) {
        return new DockerContainerRuntime(dockerClient, containerIdCache, properties.getRuntime().getContainerPrefix());
    }

    @Bean
    public ContainerSpecFactory containerSpecFactory(SandcastleProperties properties) {
        return new ContainerSpecFactory(properties);
    }
}
