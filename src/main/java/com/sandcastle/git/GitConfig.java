package com.sandcastle.git;

import com.sandcastle.core.config.SandcastleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class GitConfig {

    private static final Logger log = LoggerFactory.getLogger(GitConfig.class);

    @Bean
    @ConditionalOnMissingBean(GitBackend.class)
    public GitBackend fileSystemGitBackend(SandcastleProperties properties) {
        var git = properties.getGit();
        var backend = new FileSystemGitBackend(
                Path.of(git.getReposDir()),
                git.getDefaultBranch(),
                new CommitAuthor(git.getAuthorName(), git.getAuthorEmail()));
        log.info("Sandbox repositories stored under {}", backend.getReposDir());
        return backend;
    }
}
