package com.questrail.vcd.model;

import com.questrail.vcd.api.SignalId;

import java.util.List;
import java.util.Objects;

/**
 * A declared variable of a dump.
 *
 * <p>The hierarchical {@code name} is the scope path and leaf name joined with
 * dots, computed once when the declaration is registered
 * (e.g. {@code spi_master_tb.dut.sclk}).</p>
 *
 * @param id        identifier token used by value changes
 * @param varType   declared kind, e.g. {@code wire}, {@code reg}, {@code integer}
 * @param width     bit width, 1 for scalars
 * @param scopePath enclosing scope names, outermost first
 * @param leafName  the declared name without scope
 * @param name      dot-joined hierarchical name
 */
public record Signal(
        SignalId id,
        String varType,
        int width,
        List<String> scopePath,
        String leafName,
        String name
) {
    public Signal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(varType, "varType");
        Objects.requireNonNull(leafName, "leafName");
        Objects.requireNonNull(name, "name");
        scopePath = List.copyOf(Objects.requireNonNull(scopePath, "scopePath"));
        if (width < 1) {
            throw new IllegalArgumentException("Signal width must be at least 1 (was " + width + ")");
        }
    }

    /**
     * Creates a signal, deriving the hierarchical name from scope path and leaf.
     */
    public static Signal declare(SignalId id, String varType, int width, List<String> scopePath, String leafName) {
        Objects.requireNonNull(scopePath, "scopePath");
        String name = scopePath.isEmpty() ? leafName : String.join(".", scopePath) + "." + leafName;
        return new Signal(id, varType, width, scopePath, leafName, name);
    }

    public boolean isScalar() {
        return width == 1;
    }

    /**
     * The value a signal holds before its first recorded change:
     * {@code x} repeated to the declared width.
     */
    public String unknownValue() {
        return "x".repeat(width);
    }
}
