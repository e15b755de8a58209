package org.smilesforge.codegen.branch;

import org.smilesforge.ast.Attachment;

import java.util.ArrayList;
import java.util.List;

/**
 * One nesting level of the output. Holds the attachments whose emission waits until the
 * branches opened below this level are closed again.
 */
final class BranchFrame {

    private final int depth;
    private final List<Attachment> deferred = new ArrayList<>();

    BranchFrame(int depth) {
        this.depth = depth;
    }

    int depth() {
        return depth;
    }

    void defer(Attachment attachment) {
        deferred.add(attachment);
    }

    /**
     * Removes and returns the deferred attachments matching the given inline flag.
     */
    List<Attachment> drain(boolean inline) {
        List<Attachment> drained = new ArrayList<>();
        deferred.removeIf(attachment -> {
            if (attachment.isInline() == inline) {
                drained.add(attachment);
                return true;
            }
            return false;
        });
        return drained;
    }

    List<Attachment> drainAll() {
        List<Attachment> drained = new ArrayList<>(deferred);
        deferred.clear();
        return drained;
    }

    boolean hasDeferred() {
        return !deferred.isEmpty();
    }
}
