package org.smilesforge.codegen.branch;

import org.smilesforge.ast.Attachment;
import org.smilesforge.codegen.RenderContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Writes a sequence of atoms whose branch depth varies from atom to atom.
 * <p>
 * The walker keeps a stack of open branch frames in step with the {@code (} and {@code )} it
 * writes. Attachments of an atom that is directly followed by a deeper branch are deferred into
 * the frame of the atom's depth and written once the branch closes back to that depth, as
 * dictated by the {@link ClosePolicy}.
 * <p>
 * A walker serves exactly one traversal and is not thread-safe.
 */
public final class BranchWalker {

    private final RenderContext ctx;
    private final ClosePolicy policy;
    private final StringBuilder out = new StringBuilder();
    private final Deque<BranchFrame> frames = new ArrayDeque<>();

    public BranchWalker(RenderContext ctx, ClosePolicy policy) {
        this.ctx = ctx;
        this.policy = policy;
        frames.push(new BranchFrame(0));
    }

    /**
     * @return The current branch depth, 0 outside any branch.
     */
    public int depth() {
        return frames.peek().depth();
    }

    /**
     * Appends literal text (atom, bond, ring-closure label). Null and empty text are ignored.
     */
    public BranchWalker append(String text) {
        if (text != null && !text.isEmpty()) {
            out.append(text);
        }
        return this;
    }

    /**
     * Opens or closes branches until the current depth equals {@code targetDepth}.
     */
    public void moveTo(int targetDepth) {
        open(targetDepth);
        close(targetDepth);
    }

    /**
     * Writes {@code (} until the current depth reaches {@code targetDepth}.
     */
    public void open(int targetDepth) {
        while (depth() < targetDepth) {
            out.append('(');
            frames.push(new BranchFrame(depth() + 1));
        }
    }

    /**
     * Writes {@code )} until the current depth drops to {@code targetDepth}, releasing the
     * attachments deferred at each depth that is re-entered.
     */
    public void close(int targetDepth) {
        while (depth() > targetDepth) {
            frames.pop();
            BranchFrame reentered = frames.peek();
            if (policy == ClosePolicy.SIBLING_SPLIT) {
                // inline continuations still belong to the branch being closed
                for (Attachment attachment : reentered.drain(true)) {
                    out.append(ctx.render(attachment.node()));
                }
                out.append(')');
                for (Attachment attachment : reentered.drain(false)) {
                    emitAttachment(attachment);
                }
            } else {
                out.append(')');
                for (Attachment attachment : reentered.drainAll()) {
                    emitAttachment(attachment);
                }
            }
        }
    }

    /**
     * Writes or defers the attachments of the atom just written.
     *
     * @param attachments         The atom's attachments.
     * @param inlineBranchFollows Whether the next atom sits deeper than this one.
     */
    public void placeAttachments(List<Attachment> attachments, boolean inlineBranchFollows) {
        BranchFrame current = frames.peek();
        for (Attachment attachment : attachments) {
            Attachment resolved = policy.resolvePlacement(attachment, inlineBranchFollows);
            if (inlineBranchFollows) {
                current.defer(resolved);
            } else {
                emitAttachment(resolved);
            }
        }
    }

    /**
     * Writes an attachment, wrapped in parentheses unless it is inline.
     */
    public void emitAttachment(Attachment attachment) {
        if (attachment.isInline()) {
            out.append(ctx.render(attachment.node()));
        } else {
            out.append('(').append(ctx.render(attachment.node())).append(')');
        }
    }

    /**
     * Closes every open branch, writes whatever is still deferred at depth 0 and returns the text.
     */
    public String finish() {
        close(0);
        BranchFrame root = frames.peek();
        if (root.hasDeferred()) {
            for (Attachment attachment : root.drainAll()) {
                emitAttachment(attachment);
            }
        }
        return out.toString();
    }
}
