package org.tensorscript.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The stack of binding frames of the function being translated.
 * <p>
 * The outermost frame belongs to the function itself; every branch or loop body pushes a frame
 * for its lifetime. Lookup walks from the innermost frame outwards and finally consults the
 * module-level {@link GlobalEnvironment}.
 */
public class ScopeStack {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeStack.class);

    /**
     * A single binding frame.
     */
    public static final class Frame {
        private final String label;
        private final Map<String, Binding> bindings = new LinkedHashMap<>();

        Frame(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public Map<String, Binding> bindings() {
            return Collections.unmodifiableMap(bindings);
        }
    }

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final GlobalEnvironment globals;

    /**
     * Creates a stack with one frame for the function body.
     * @param globals The module-level environment.
     * @param functionName The label of the outermost frame.
     */
    public ScopeStack(GlobalEnvironment globals, String functionName) {
        this.globals = globals;
        frames.push(new Frame(functionName));
    }

    /**
     * Enters a new frame.
     * @param label A label for debugging, e.g. the subgraph name.
     * @return The new frame.
     */
    public Frame enterScope(String label) {
        Frame frame = new Frame(label);
        frames.push(frame);
        LOG.debug("enter scope {} (depth {})", label, frames.size());
        return frame;
    }

    /**
     * Leaves the innermost frame. The function frame cannot be left.
     * @throws IllegalStateException if only the function frame is left.
     */
    public void leaveScope() {
        if (frames.size() == 1) {
            throw new IllegalStateException("Cannot leave the function scope.");
        }
        Frame frame = frames.pop();
        LOG.debug("leave scope {} (depth {})", frame.label(), frames.size());
    }

    /**
     * Binds a name in the innermost frame, replacing an earlier binding in that frame.
     * @param name The script name.
     * @param binding The binding.
     */
    public void define(String name, Binding binding) {
        LOG.debug("bind {} -> {}", name, binding);
        frames.peek().bindings.put(name, binding);
    }

    /**
     * Resolves a name, innermost frame first, then the module environment.
     * @param name The script name.
     * @return The binding, or empty if the name is unbound.
     */
    public Optional<Binding> resolve(String name) {
        for (Frame frame : frames) {
            Binding binding = frame.bindings.get(name);
            if (binding != null) return Optional.of(binding);
        }
        return globals.resolve(name);
    }

    /**
     * Resolves a name in the innermost frame only.
     * @param name The script name.
     * @return The binding, or empty if the innermost frame does not bind the name.
     */
    public Optional<Binding> resolveLocal(String name) {
        return Optional.ofNullable(frames.peek().bindings.get(name));
    }

    /**
     * Resolves a name in the enclosing frames, skipping the innermost one. Module bindings are not consulted.
     * @param name The script name.
     * @return The binding, or empty if no enclosing frame binds the name.
     */
    public Optional<Binding> resolveOuter(String name) {
        Iterator<Frame> it = frames.iterator();
        it.next();
        while (it.hasNext()) {
            Binding binding = it.next().bindings.get(name);
            if (binding != null) return Optional.of(binding);
        }
        return Optional.empty();
    }

    /**
     * @return The innermost frame.
     */
    public Frame current() {
        return frames.peek();
    }

    /**
     * @return The number of frames, at least 1.
     */
    public int depth() {
        return frames.size();
    }

    public GlobalEnvironment globals() {
        return globals;
    }
}
