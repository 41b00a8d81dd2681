package com.hexarchitect.core.export;

import com.hexarchitect.core.model.Layer;

/**
 * Fill colours per layer shared by the diagram exporters.
 */
final class LayerColors {

    private LayerColors() {
        // Utility class
    }

    static String colorFor(Layer layer) {
        return switch (layer) {
            case DOMAIN -> "lightblue";
            case PORT -> "lightgreen";
            case APPLICATION -> "lightcoral";
            case ADAPTER -> "lightyellow";
            case INFRASTRUCTURE -> "lightgray";
        };
    }
}
