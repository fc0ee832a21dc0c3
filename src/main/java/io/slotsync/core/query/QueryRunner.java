/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2020-2030 The XdagJ Developers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.slotsync.core.query;

import io.slotsync.core.StartTime;
import io.slotsync.core.era.EraInterpreter;
import io.slotsync.core.era.PastHorizonException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;

/**
 * Evaluates a {@link Query}. Era-contained leaves are handed to the {@link EraInterpreter} one at
 * a time, and the first one that fails aborts the whole query.
 */
public final class QueryRunner {

    private QueryRunner() {
    }

    /**
     * Runs a query against one era interpreter snapshot.
     *
     * @param startTime
     *            answer to {@link Query#startTime()}
     * @param interpreter
     *            answers the era-contained parts of the query
     * @param query
     *            the query to run
     * @return the answer, or the first past horizon failure
     */
    @SuppressWarnings("unchecked")
    public static <T> QueryResult<T> run(StartTime startTime, EraInterpreter interpreter, Query<T> query) {
        // binds are unwound onto an explicit stack so that long chains do not overflow the call stack
        Deque<Function<Object, ?>> continuations = new ArrayDeque<>();
        Query<?> current = query;

        while (true) {
            if (current instanceof Query.Bind) {
                Query.Bind<Object, ?> bind = (Query.Bind<Object, ?>) current;
                continuations.push((Function<Object, ?>) bind.getContinuation());
                current = bind.getSource();
                continue;
            }

            Object value;
            try {
                value = evaluate(startTime, interpreter, current);
            } catch (PastHorizonException e) {
                return QueryResult.pastHorizon(e);
            }

            if (continuations.isEmpty()) {
                return QueryResult.success((T) value);
            }
            current = (Query<?>) continuations.pop().apply(value);
            if (current == null) {
                throw new IllegalStateException("Query continuation returned null for " + value);
            }
        }
    }

    private static Object evaluate(StartTime startTime, EraInterpreter interpreter, Query<?> query)
            throws PastHorizonException {
        if (query instanceof Query.EraContained) {
            return interpreter.interpretQuery(((Query.EraContained<?>) query).getQuery());
        } else if (query instanceof Query.Pure) {
            return ((Query.Pure<?>) query).getValue();
        } else if (query instanceof Query.QueryStartTime) {
            return startTime;
        }
        throw new IllegalArgumentException("Unknown query type: " + query.getClass().getName());
    }
}
