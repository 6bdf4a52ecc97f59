package com.field.audit.source;

/**
 * Supplies the identifier of the actor performing the current update.
 */
@FunctionalInterface
public interface ActorContext {

    String currentActorId();
}
