package com.tyron.lylex.api.lexer;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * State change applied after a {@link Rule} matched.
 *
 * Instances are immutable and do not know the grammar they are used in; state names are
 * resolved against the {@link Grammar} when the transition is applied. The names a
 * transition refers to are checked when the grammar is built.
 */
public abstract class Transition {

    private static final Transition NONE = new None();
    private static final Transition POP = new Pop(1);

    Transition() {
    }

    public static Transition none() {
        return NONE;
    }

    /**
     * Enters the named state on top of the current one.
     */
    public static Transition push(@NotNull String state) {
        return new Push(requireName(state));
    }

    /**
     * Leaves the current state. The bottom state of a stack is never left.
     */
    public static Transition pop() {
        return POP;
    }

    public static Transition pop(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("pop count must be positive, got " + count);
        }
        return count == 1 ? POP : new Pop(count);
    }

    /**
     * Replaces the current state with the named one, keeping the depth.
     */
    public static Transition switchTo(@NotNull String state) {
        return new Switch(requireName(state));
    }

    /**
     * Chooses between two transitions depending on whether the named capture group of
     * the rule's pattern took part in the match.
     */
    public static Transition byGroup(@NotNull String group, @NotNull Transition matched, @NotNull Transition otherwise) {
        return new ByGroup(requireName(group), Objects.requireNonNull(matched, "matched"),
                Objects.requireNonNull(otherwise, "otherwise"));
    }

    /**
     * Returns the transition to apply for a concrete match.
     *
     * @param matcher the matcher positioned on the successful match
     */
    public Transition resolve(Matcher matcher) {
        return this;
    }

    /**
     * Applies this transition. Only called on resolved transitions.
     */
    public abstract StateStack apply(StateStack stack, Grammar grammar);

    /**
     * @return the state names this transition may enter
     */
    public abstract Set<String> getTargetStates();

    /**
     * @return the capture group names this transition inspects
     */
    public Set<String> getGroupNames() {
        return Collections.emptySet();
    }

    public boolean isNone() {
        return this == NONE;
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        return name;
    }

    private static final class None extends Transition {

        @Override
        public StateStack apply(StateStack stack, Grammar grammar) {
            return stack;
        }

        @Override
        public Set<String> getTargetStates() {
            return Collections.emptySet();
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    private static final class Push extends Transition {

        private final String state;

        Push(String state) {
            this.state = state;
        }

        @Override
        public StateStack apply(StateStack stack, Grammar grammar) {
            return stack.push(grammar.getState(state));
        }

        @Override
        public Set<String> getTargetStates() {
            return Collections.singleton(state);
        }

        @Override
        public String toString() {
            return "push(" + state + ")";
        }
    }

    private static final class Pop extends Transition {

        private final int count;

        Pop(int count) {
            this.count = count;
        }

        @Override
        public StateStack apply(StateStack stack, Grammar grammar) {
            return stack.pop(count);
        }

        @Override
        public Set<String> getTargetStates() {
            return Collections.emptySet();
        }

        @Override
        public String toString() {
            return count == 1 ? "pop" : "pop(" + count + ")";
        }
    }

    private static final class Switch extends Transition {

        private final String state;

        Switch(String state) {
            this.state = state;
        }

        @Override
        public StateStack apply(StateStack stack, Grammar grammar) {
            return stack.switchTo(grammar.getState(state));
        }

        @Override
        public Set<String> getTargetStates() {
            return Collections.singleton(state);
        }

        @Override
        public String toString() {
            return "switch(" + state + ")";
        }
    }

    private static final class ByGroup extends Transition {

        private final String group;
        private final Transition matched;
        private final Transition otherwise;

        ByGroup(String group, Transition matched, Transition otherwise) {
            this.group = group;
            this.matched = matched;
            this.otherwise = otherwise;
        }

        @Override
        public Transition resolve(Matcher matcher) {
            Transition chosen = matcher.start(group) >= 0 ? matched : otherwise;
            return chosen.resolve(matcher);
        }

        @Override
        public StateStack apply(StateStack stack, Grammar grammar) {
            throw new IllegalStateException("byGroup(" + group + ") must be resolved against a match first");
        }

        @Override
        public Set<String> getTargetStates() {
            Set<String> targets = new LinkedHashSet<>(matched.getTargetStates());
            targets.addAll(otherwise.getTargetStates());
            return targets;
        }

        @Override
        public Set<String> getGroupNames() {
            Set<String> groups = new LinkedHashSet<>();
            groups.add(group);
            groups.addAll(matched.getGroupNames());
            groups.addAll(otherwise.getGroupNames());
            return groups;
        }

        @Override
        public String toString() {
            return "byGroup(" + group + ", " + matched + ", " + otherwise + ")";
        }
    }
}
