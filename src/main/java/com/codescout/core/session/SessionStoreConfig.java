package com.codescout.core.session;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the file-backed session store and its lock registry.
 */
@Configuration
public class SessionStoreConfig {

    @Bean
    public SessionLockRegistry sessionLockRegistry(SessionProperties properties) {
        return new SessionLockRegistry(properties.getDirectory());
    }

    @Bean
    public SessionStore sessionStore(SessionProperties properties, SessionLockRegistry lockRegistry) {
        return new FileSessionStore(properties.getDirectory(), lockRegistry);
    }
}
