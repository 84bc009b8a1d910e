package com.sketchsync.service;

/**
 * One way of creating the initial replica. The store tries the registered initializers in
 * {@link org.springframework.core.annotation.Order} and keeps the first success.
 */
public interface DocumentInitializer {

    String getName();

    InitializationResult initialize(String actorId);
}
