package com.rotseproc.algs.pa;

import com.rotseproc.core.DataKind;
import com.rotseproc.core.ProcessingStage;
import com.rotseproc.external.Toolchain;

import java.util.Objects;

/** A processing stage that drives external tools. */
abstract class ToolStage extends ProcessingStage {
    private final Toolchain tools;

    ToolStage(String name, String defaultName, DataKind outputKind, Toolchain tools) {
        super(name, defaultName, DataKind.IMAGE_COLLECTION, outputKind);
        this.tools = Objects.requireNonNull(tools, "tools");
    }

    ToolStage(String name, String defaultName, Toolchain tools) {
        this(name, defaultName, DataKind.IMAGE_COLLECTION, tools);
    }

    final Toolchain tools() {
        return tools;
    }
}
