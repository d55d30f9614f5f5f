package dev.pekelund.billing.decision;

/**
 * Answers whether a previously generated artifact still exists where history says it was put.
 */
@FunctionalInterface
public interface ArtifactLocator {

    boolean exists(String artifactRef);
}
