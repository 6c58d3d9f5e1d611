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

package bitflags.primitives;

import bitflags.api.Width;

/**
 * Set algebra over raw flag bit patterns of a given {@link Width}. None of these operations can fail:
 * every combination of in-width values is itself a valid value, including ones with unnamed bits.
 * Only the operations that invert bits take a width, since they are the only ones that could
 * otherwise produce bits outside it.
 */
public class FlagAlgebra
{
    private FlagAlgebra() {}

    public static long union(long a, long b)
    {
        return a | b;
    }

    public static long intersect(long a, long b)
    {
        return a & b;
    }

    public static long symmetricDifference(long a, long b)
    {
        return a ^ b;
    }

    public static long complement(Width width, long a)
    {
        return ~a & width.mask();
    }

    /**
     * Removes the bits of {@code b} from {@code a}; equivalently {@code intersect(a, complement(b))}.
     */
    public static long difference(Width width, long a, long b)
    {
        return a & (~b & width.mask());
    }

    /**
     * Exact equality; unnamed bits are significant.
     */
    public static boolean equals(long a, long b)
    {
        return a == b;
    }

    /**
     * @return true iff {@code a} has every bit of {@code b}; trivially true for {@code b == 0}
     */
    public static boolean contains(long a, long b)
    {
        return (a & b) == b;
    }

    public static boolean containsAny(long a, long b)
    {
        return (a & b) != 0;
    }

    public static boolean isEmpty(long a)
    {
        return a == 0;
    }

    public static boolean within(Width width, long a)
    {
        return width.fits(a);
    }
}
