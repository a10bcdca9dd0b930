// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import uk.co.farowl.unpyc3.support.InvariantError;
import uk.co.farowl.unpyc3.support.UnsupportedConstructError;

/**
 * The symbolic stack of the abstract machine. Alongside the slots, we
 * count how many times each item (by identity) is present, so that a
 * store can tell whether another reference to the same value remains,
 * as it does after {@code DUP_TOP} in a chained assignment.
 */
final class EvaluationStack {

    private final List<StackItem> stack = new ArrayList<>();
    private final Map<StackItem, Integer> counts = new IdentityHashMap<>();

    /**
     * Push items in order, so the last becomes the top.
     *
     * @param items to push
     */
    void push(StackItem... items) {
        for (StackItem item : items) {
            stack.add(item);
            counts.merge(item, 1, Integer::sum);
        }
    }

    /**
     * Pop the top item.
     *
     * @return the item that was on top
     * @throws InvariantError if the stack is empty
     */
    StackItem pop() throws InvariantError {
        if (stack.isEmpty()) {
            throw new InvariantError("pop from empty evaluation stack");
        }
        StackItem item = stack.remove(stack.size() - 1);
        counts.computeIfPresent(item, (k, n) -> n > 1 ? n - 1 : null);
        return item;
    }

    /**
     * Pop {@code n} items, returning them in the order they were on the
     * stack (the former top last).
     *
     * @param n number to pop
     * @return the items
     * @throws InvariantError if there are too few items
     */
    List<StackItem> pop(int n) throws InvariantError {
        if (n > stack.size()) {
            throw new InvariantError("pop %d from evaluation stack of %d",
                    n, stack.size());
        }
        StackItem[] items = new StackItem[n];
        for (int i = n - 1; i >= 0; --i) { items[i] = pop(); }
        return List.of(items);
    }

    /**
     * Pop the top item, which must be an expression.
     *
     * @return the expression
     * @throws UnsupportedConstructError if the top is not an expression
     */
    Expr popExpr() throws UnsupportedConstructError {
        StackItem item = pop();
        if (item instanceof Expr e) { return e; }
        throw new UnsupportedConstructError(
                "expected an expression on the stack, found %s",
                item.getClass().getSimpleName());
    }

    /**
     * Pop {@code n} expressions, in stack order.
     *
     * @param n number to pop
     * @return the expressions
     */
    List<Expr> popExprs(int n) {
        Expr[] items = new Expr[n];
        for (int i = n - 1; i >= 0; --i) { items[i] = popExpr(); }
        return List.of(items);
    }

    /**
     * The top item, without popping it.
     *
     * @return the top item
     * @throws InvariantError if the stack is empty
     */
    StackItem peek() throws InvariantError {
        if (stack.isEmpty()) {
            throw new InvariantError("peek at empty evaluation stack");
        }
        return stack.get(stack.size() - 1);
    }

    /**
     * The top {@code n} items, in stack order, without popping them.
     *
     * @param n number of items
     * @return the items
     */
    List<StackItem> peek(int n) {
        if (n > stack.size()) {
            throw new InvariantError("peek %d at evaluation stack of %d", n,
                    stack.size());
        }
        return List.copyOf(stack.subList(stack.size() - n, stack.size()));
    }

    /**
     * Whether this exact item occupies any slot.
     *
     * @param item to look for
     * @return whether present
     */
    boolean contains(StackItem item) { return counts.containsKey(item); }

    /**
     * The number of slots this exact item occupies.
     *
     * @param item to count
     * @return number of occurrences
     */
    int count(StackItem item) { return counts.getOrDefault(item, 0); }

    int size() { return stack.size(); }

    boolean isEmpty() { return stack.isEmpty(); }

    @Override
    public String toString() { return stack.toString(); }
}
