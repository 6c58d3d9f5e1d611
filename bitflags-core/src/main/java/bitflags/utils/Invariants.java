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

package bitflags.utils;

import javax.annotation.Nullable;

/**
 * Precondition and state checks used throughout the engine. Argument failures surface as
 * {@link IllegalArgumentException}, state failures as {@link IllegalStateException}.
 */
public class Invariants
{
    private static final boolean PARANOID = Boolean.getBoolean("bitflags.paranoid");

    private Invariants() {}

    /**
     * Expensive self-checks (e.g. re-verifying a resolved table) are only performed when the
     * {@code bitflags.paranoid} system property is set.
     */
    public static boolean isParanoid()
    {
        return PARANOID;
    }

    public static IllegalStateException illegalState(String fmt, Object... args)
    {
        return new IllegalStateException(String.format(fmt, args));
    }

    public static IllegalArgumentException illegalArgument(String fmt, Object... args)
    {
        return new IllegalArgumentException(String.format(fmt, args));
    }

    public static void require(boolean condition, String fmt, @Nullable Object arg)
    {
        if (!condition)
            throw illegalState(fmt, arg);
    }

    public static void require(boolean condition, String fmt, @Nullable Object arg1, @Nullable Object arg2)
    {
        if (!condition)
            throw illegalState(fmt, arg1, arg2);
    }

    public static void requireArgument(boolean condition, String fmt, @Nullable Object arg1, @Nullable Object arg2)
    {
        if (!condition)
            throw illegalArgument(fmt, arg1, arg2);
    }

    public static <T> T nonNull(T param)
    {
        if (param == null)
            throw new NullPointerException();
        return param;
    }

    public static <T> T nonNull(T param, String msg)
    {
        if (param == null)
            throw new NullPointerException(msg);
        return param;
    }
}
