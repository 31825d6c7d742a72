package io.hearthwarrio.stableid.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * "Where am I" context of one traversal pass: a stack of human-readable frames
 * (e.g. {@code screen:UserProfile}, {@code container:NavigationView}) plus the current screen label.
 * <p>
 * Popping an empty stack is a no-op: traversal code may pop without tracking its exact depth.
 * All methods are synchronized on the instance.
 */
public final class HierarchyTracker {

    public static final String DEFAULT_SCREEN_CONTEXT = "main";

    private final List<String> frames = new ArrayList<>();
    private String screenContext = DEFAULT_SCREEN_CONTEXT;

    /**
     * Pushes a frame. Null labels are ignored.
     */
    public synchronized void pushFrame(String label) {
        if (label == null) {
            return;
        }
        frames.add(label);
    }

    /**
     * Pops the innermost frame, if any.
     */
    public synchronized void popFrame() {
        if (!frames.isEmpty()) {
            frames.remove(frames.size() - 1);
        }
    }

    /**
     * Replaces the whole stack (outermost first). Null labels are skipped.
     */
    public synchronized void setFrames(List<String> labels) {
        frames.clear();
        if (labels == null) {
            return;
        }
        for (String label : labels) {
            if (label != null) {
                frames.add(label);
            }
        }
    }

    public synchronized void setScreenContext(String label) {
        screenContext = (label == null || label.isBlank()) ? DEFAULT_SCREEN_CONTEXT : label;
    }

    /**
     * Same as {@link #setScreenContext(String)}; navigation code tends to think in states, not screens.
     */
    public void setNavigationState(String state) {
        setScreenContext(state);
    }

    public synchronized String screenContext() {
        return screenContext;
    }

    public synchronized boolean isEmpty() {
        return frames.isEmpty();
    }

    public synchronized int depth() {
        return frames.size();
    }

    /**
     * Copy of the stack, outermost first.
     */
    public synchronized List<String> frames() {
        return Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public synchronized Optional<String> innermostFrame() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
    }

    /**
     * Clears frames and restores the default screen context. Called between traversal passes.
     */
    public synchronized void reset() {
        frames.clear();
        screenContext = DEFAULT_SCREEN_CONTEXT;
    }

    /**
     * Display part of a frame label: text after the first {@code ':'} ({@code container:Nav} -> {@code Nav}).
     */
    static String frameName(String label) {
        int colon = label.indexOf(':');
        if (colon < 0) {
            return label;
        }
        String name = label.substring(colon + 1);
        return name.isBlank() ? label.substring(0, colon) : name;
    }

    @Override
    public synchronized String toString() {
        return "HierarchyTracker{" +
                "screenContext='" + screenContext + '\'' +
                ", frames=" + frames +
                '}';
    }
}
