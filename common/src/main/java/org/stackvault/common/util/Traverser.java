/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stackvault.common.util;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;

// depth first traversal without recursion, call stacks can be thousands of frames deep
public abstract class Traverser<T extends /*@NonNull*/ Object, E extends Exception> {

    private static final Object ALREADY_TRAVERSED_MARKER = new Object();

    private final Deque<Object> stack = new ArrayDeque<Object>();

    private int depth;

    public Traverser(T root) {
        stack.push(root);
    }

    @SuppressWarnings("unchecked")
    public void traverse() throws E {
        while (!stack.isEmpty()) {
            Object popped = stack.pop();
            if (popped == ALREADY_TRAVERSED_MARKER) {
                depth--;
                revisitAfterChildren((T) stack.pop(), depth);
                continue;
            }
            T unprocessed = (T) popped;
            Collection<T> childNodes = visit(unprocessed, depth);
            if (childNodes.isEmpty()) {
                revisitAfterChildren(unprocessed, depth);
            } else {
                stack.push(unprocessed);
                stack.push(ALREADY_TRAVERSED_MARKER);
                // pushed in reverse so that children are visited in iteration order
                Deque<T> reversed = new ArrayDeque<T>(childNodes.size());
                for (Iterator<T> i = childNodes.iterator(); i.hasNext();) {
                    reversed.push(i.next());
                }
                for (T childNode : reversed) {
                    stack.push(childNode);
                }
                depth++;
            }
        }
    }

    public abstract Collection<T> visit(T node, int depth) throws E;

    protected void revisitAfterChildren(@SuppressWarnings("unused") T node,
            @SuppressWarnings("unused") int depth) throws E {}
}
