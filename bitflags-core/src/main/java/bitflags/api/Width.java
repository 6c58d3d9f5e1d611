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

package bitflags.api;

/**
 * The unsigned integer width backing a flag enum. All widths are carried in a {@code long}
 * interpreted as unsigned; {@link #WORD} is the platform word, which on the JVM is 64 bits.
 */
public enum Width
{
    U8(8), U16(16), U32(32), U64(64), WORD(64);

    public static final Width DEFAULT = WORD;

    private final int bits;
    private final long mask;

    Width(int bits)
    {
        this.bits = bits;
        this.mask = bits == Long.SIZE ? -1L : (1L << bits) - 1;
    }

    public int bits()
    {
        return bits;
    }

    /**
     * @return every bit of this width set
     */
    public long mask()
    {
        return mask;
    }

    public boolean fits(long value)
    {
        return (value & ~mask) == 0;
    }

    public String toHexString(long value)
    {
        return "0x" + Long.toHexString(value);
    }
}
