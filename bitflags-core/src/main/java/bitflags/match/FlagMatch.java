/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package bitflags.match;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import bitflags.api.FlagEnum;
import bitflags.api.FlagValue;

import static bitflags.utils.Invariants.illegalState;
import static bitflags.utils.Invariants.requireArgument;

/**
 * Arms are tried in the order they are added and the first one that applies wins:
 * <pre>
 * String s = flags.&lt;String&gt;match(value)
 *                 .when("None", () -&gt; "None")
 *                 .when("A", () -&gt; "A")
 *                 .whenComposed(v -&gt; v.equals(a.or(b)), v -&gt; "A and B")
 *                 .otherwise(v -&gt; "Others");
 * </pre>
 * A {@code when} arm only applies to the named case; a {@code whenComposed} arm only to the composed case.
 */
public class FlagMatch<R>
{
    private final FlagEnum type;
    private final FlagCase flagCase;
    private boolean matched;
    private R result;

    public FlagMatch(FlagEnum type, FlagCase flagCase)
    {
        this.type = type;
        this.flagCase = flagCase;
    }

    public FlagCase flagCase()
    {
        return flagCase;
    }

    public FlagMatch<R> when(String variant, Supplier<? extends R> supplier)
    {
        requireArgument(type.table().get(variant) != null, "%s has no variant %s", type.name(), variant);
        if (!matched && !flagCase.isComposed() && flagCase.variant().name().equals(variant))
            complete(supplier.get());
        return this;
    }

    public FlagMatch<R> whenComposed(Predicate<? super FlagValue> guard, Function<? super FlagValue, ? extends R> function)
    {
        if (!matched && flagCase.isComposed() && guard.test(flagCase.value()))
            complete(function.apply(flagCase.value()));
        return this;
    }

    /**
     * Shorthand for a composed arm guarded by equality with {@code equalTo}.
     */
    public FlagMatch<R> whenComposed(FlagValue equalTo, Supplier<? extends R> supplier)
    {
        if (!matched && flagCase.isComposed() && flagCase.value().equals(equalTo))
            complete(supplier.get());
        return this;
    }

    public R otherwise(Function<? super FlagValue, ? extends R> function)
    {
        return matched ? result : function.apply(flagCase.value());
    }

    public boolean isMatched()
    {
        return matched;
    }

    /**
     * @throws IllegalStateException if no arm applied
     */
    public R get()
    {
        if (!matched)
            throw illegalState("No arm matched %s", flagCase);
        return result;
    }

    private void complete(R result)
    {
        this.result = result;
        this.matched = true;
    }
}
