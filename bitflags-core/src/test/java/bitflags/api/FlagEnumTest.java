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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import bitflags.utils.Gens;

import static bitflags.utils.Property.qt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FlagEnumTest
{
    private static final FlagEnum FLAGS = FlagEnum.declare(FlagEnumDescriptor.builder("Flags")
                                                                             .width(Width.U8)
                                                                             .variant("None", 0)
                                                                             .variant("A", 1)
                                                                             .variant("B", 2)
                                                                             .variant("C", 4)
                                                                             .build());
    private static final FlagValue NONE = FLAGS.none(), A = FLAGS.of("A"), B = FLAGS.of("B"), C = FLAGS.of("C");

    @Test
    public void algebra()
    {
        FlagValue e1 = A.or(C);
        FlagValue e2 = B.or(C);

        assertThat(e1.or(e2)).isEqualTo(A.or(B).or(C));
        assertThat(e1.and(e2)).isEqualTo(C);
        assertThat(e1.xor(e2)).isEqualTo(A.or(B));
        assertThat(e1.and(C.not())).isEqualTo(A);
        assertThat(e1.minus(C)).isEqualTo(A);
        assertThat(e1.difference(C)).isEqualTo(A);

        assertThat(e1.toString()).isEqualTo("(Flags::A | Flags::C)");
        assertThat(e1.has("A")).isTrue();
        assertThat(e1.has("B")).isFalse();
        assertThat(e1.hasFlag(C)).isTrue();
        assertThat(e1.contains(C)).isTrue();
    }

    @Test
    public void updateByReassignment()
    {
        FlagValue s = A;
        s = s.or(B);
        assertThat(s.toString()).isEqualTo("(Flags::A | Flags::B)");
        s = s.and(C);
        assertThat(s).isEqualTo(NONE);
        assertThat(s).isSameAs(NONE);
    }

    @Test
    public void hasFlag()
    {
        FlagValue s = A.or(B);
        assertThat(s.hasFlag(B)).isTrue();
        assertThat(FLAGS.accessor("has_b").test(s)).isTrue();
        assertThat(s.hasFlag(C)).isFalse();
        assertThat(s.intersects(B.or(C))).isTrue();
        assertThat(s.intersects(C)).isFalse();
    }

    @Test
    public void everyValueHasEmptyFlag()
    {
        assertThat(NONE.hasFlag(NONE)).isTrue();
        assertThat(FLAGS.accessor("has_none").test(NONE)).isTrue();
        assertThat(A.or(B).has("None")).isTrue();
        assertThat(A.or(B).hasFlag(NONE)).isTrue();
        assertThat(FLAGS.accessor("has_none").test(A)).isTrue();
        assertThat(FLAGS.fromBits(0x80).has("None")).isTrue();
        assertThat(NONE.isEmpty()).isTrue();
        assertThat(NONE.has("A")).isFalse();
        assertThat(NONE.toString()).isEqualTo("Flags::None");
    }

    @Test
    public void accessors()
    {
        assertThat(FLAGS.accessorNames()).containsExactly("has_none", "has_a", "has_b", "has_c");

        FlagEnum http = FlagEnum.declare(FlagEnumDescriptor.builder("Http")
                                                           .variants("None", "KeepAlive", "Gzip")
                                                           .build());
        FlagValue keepAlive = http.of("KeepAlive");
        assertThat(http.accessorNames()).containsExactly("has_none", "has_keep_alive", "has_gzip");
        assertThat(http.accessor("has_keep_alive").test(keepAlive)).isTrue();
        assertThat(http.accessor("has_gzip").test(keepAlive)).isFalse();
        assertThatThrownBy(() -> http.accessor("has_gzip").test(A)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> http.accessor("has_a")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void isAll()
    {
        assertThat(A.or(B).or(C).isAll()).isTrue();
        assertThat(FLAGS.all()).isEqualTo(A.or(B).or(C));
        assertThat(A.or(B).isAll()).isFalse();
        assertThat(FLAGS.fromBits(0xFF).isAll()).isFalse();
    }

    @Test
    public void rawConversion()
    {
        assertThat(FLAGS.fromBits(5)).isEqualTo(A.or(C));
        assertThat(FLAGS.fromBits(2)).isSameAs(B);
        assertThat(A.or(C).bits()).isEqualTo(5L);
        assertThat(A.or(C).equalsBits(5)).isTrue();
        assertThat(FLAGS.of("A", "C")).isEqualTo(A.or(C));
        assertThatThrownBy(() -> FLAGS.fromBits(0x100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FLAGS.of("D")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void complementStaysInWidth()
    {
        assertThat(NONE.not().bits()).isEqualTo(0xFFL);
        assertThat(A.not().not()).isEqualTo(A);
        assertThat(A.not().toString()).isEqualTo("(Flags::B | Flags::C | 0xf8)");
    }

    @Test
    public void unnamedBitsAreSignificant()
    {
        FlagValue withExtra = A.or(FLAGS.fromBits(0x40));
        assertThat(withExtra).isNotEqualTo(A);
        assertThat(withExtra.decompose()).containsExactly("A");
        assertThat(withExtra.residual()).isEqualTo(0x40L);
        assertThat(withExtra.minus(FLAGS.fromBits(0x40))).isEqualTo(A);
        assertThat(withExtra.toString()).isEqualTo("(Flags::A | 0x40)");
    }

    @Test
    public void foreignValuesRejected()
    {
        FlagEnum other = FlagEnum.declare(FlagEnumDescriptor.builder("Flags")
                                                            .width(Width.U8)
                                                            .variants("None", "A", "B", "C")
                                                            .build());
        FlagValue otherA = other.of("A");
        assertThat(otherA).isNotEqualTo(A);
        assertThat(otherA.bits()).isEqualTo(A.bits());
        assertThatThrownBy(() -> A.or(otherA)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> A.contains(otherA)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FLAGS.format(otherA)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void valuesInDeclarationOrder()
    {
        assertThat(FLAGS.values()).containsExactly(NONE, A, B, C);
        assertThat(FLAGS.variantNames()).containsExactly("None", "A", "B", "C");
    }

    @Test
    public void containment()
    {
        qt().forAll(Gens.bits(Width.U8), Gens.bits(Width.U8)).check((a, b) -> {
            FlagValue x = FLAGS.fromBits(a), y = FLAGS.fromBits(b);
            assertThat(x.or(y).contains(x)).isTrue();
            assertThat(x.contains(y) && y.contains(x)).isEqualTo(x.equals(y));
            assertThat(x.minus(x)).isEqualTo(NONE);
            assertThat(x.not().not()).isEqualTo(x);
            for (String name : x.decompose())
                assertThat(x.has(name)).isTrue();
        });
    }

    @Test
    public void sharedAcrossThreads() throws Exception
    {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try
        {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0 ; i < 64 ; ++i)
            {
                long bits = i & 7;
                results.add(executor.submit(() -> FLAGS.fromBits(bits).or(A).toString()));
            }
            for (int i = 0 ; i < 64 ; ++i)
                assertThat(results.get(i).get()).isEqualTo(FLAGS.fromBits((i & 7) | 1).toString());
        }
        finally
        {
            executor.shutdownNow();
        }
    }
}
