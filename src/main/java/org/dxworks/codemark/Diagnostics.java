package org.dxworks.codemark;

import java.util.function.Consumer;

public final class Diagnostics {

    public static final Consumer<String> STDERR = message -> System.err.println(message);

    private Diagnostics() {
    }
}
