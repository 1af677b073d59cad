package com.eainde.atlas.tools;

/**
 * What the reasoning step is told about one capability.
 */
public record ToolManifestEntry(String name, String description, ToolSchema schema) {

    public static ToolManifestEntry of(ToolCapability capability) {
        return new ToolManifestEntry(capability.name(), capability.description(), capability.schema());
    }
}
