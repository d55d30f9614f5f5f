package dev.pekelund.billing.pipeline;

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Reference to an artifact a renderer produced, later checked through an
 * {@link dev.pekelund.billing.decision.ArtifactLocator}.
 */
public record RenderedArtifact(String reference) {

    public RenderedArtifact {
        Assert.isTrue(StringUtils.hasText(reference), "reference must not be blank");
    }
}
