package com.nodegraph.codegen;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.nodegraph.codegen.io.JsonCodec;
import com.nodegraph.codegen.io.RegistryDefinition;
import com.nodegraph.codegen.registry.NodeCatalog;

/** Shared test registry, see {@code src/test/resources/fixtures/test-nodes.json}. */
public final class Fixtures {
    public static final String TEST_NODES = "/fixtures/test-nodes.json";

    private Fixtures() {
    }

    public static RegistryDefinition registry() {
        try {
            return JsonCodec.readRegistryResource(TEST_NODES);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static NodeCatalog catalog() {
        return new NodeCatalog().merge(registry());
    }
}
