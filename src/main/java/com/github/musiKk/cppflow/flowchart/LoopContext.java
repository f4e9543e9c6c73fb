package com.github.musiKk.cppflow.flowchart;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.cppflow.flowchart.Flow.Continues;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * State of one loop during traversal: where {@code continue} jumps to and the
 * {@code break} exits that leave the loop.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
class LoopContext {

    /** Target of {@code continue}; empty until the node exists (do-while condition). */
    private final Optional<String> continueTarget;
    private final List<Continues> exitTails = new ArrayList<>();
    // continues emitted before their target node existed
    private final List<Continues> deferredContinues = new ArrayList<>();
}
