package io.logictree.core.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/// Recursive helpers over the linked view of a {@link LogicTree}.
///
/// These walk {@link Branch#getChildBranchSet()} links and therefore honour
/// `applyToBranches` filters, unlike flat enumeration.
public final class LinkedTraversal {

    private LinkedTraversal() {}

    /// Counts the linked realizations descending from a branch.
    ///
    /// A leaf counts as one; otherwise the counts of every branch of the child branch-set
    /// are summed.
    ///
    /// @param branch starting branch, not null
    /// @return number of root-to-leaf paths through `branch`, at least one
    /// @throws ArithmeticException if the count overflows a `long`
    public static long countRealizations(Branch branch) {
        Objects.requireNonNull(branch, "branch must not be null");
        BranchSet child = branch.getChildBranchSet();
        if (child == null) {
            return 1;
        }
        long count = 0;
        for (Branch next : child.getBranches()) {
            count = Math.addExact(count, countRealizations(next));
        }
        return count;
    }

    /// Enumerates the leaf branches reachable from a branch, depth-first.
    ///
    /// Branch order is preserved at every level. A leaf yields itself. Each call to
    /// `iterator()` starts a fresh walk.
    ///
    /// @param branch starting branch, not null
    /// @return lazy, restartable sequence of leaves, never null
    public static Iterable<Branch> enumerateLeaves(Branch branch) {
        Objects.requireNonNull(branch, "branch must not be null");
        return () -> new LeafIterator(branch);
    }

    private static final class LeafIterator implements Iterator<Branch> {
        private final Deque<Iterator<Branch>> stack = new ArrayDeque<>();
        private Branch next;

        LeafIterator(Branch start) {
            stack.push(List.of(start).iterator());
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                Iterator<Branch> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                Branch candidate = top.next();
                if (candidate.isLeaf()) {
                    next = candidate;
                    return;
                }
                stack.push(candidate.getChildBranchSet().getBranches().iterator());
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Branch next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Branch current = next;
            advance();
            return current;
        }
    }
}
