/*
 * AACalc - Asset Allocation Calculator
 * Copyright (C) 2009, 2011-2017 Gordon Irlam
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.gordoni.retsim;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Source of all randomness for one run.
 *
 * Every scenario gets its own generators, seeded from the run seed, the scenario's base index and the stream, so a
 * scenario's draws do not depend on which worker runs it or in what order. With antithetic pairing scenarios 2k and
 * 2k+1 share a base index and so share all draws; the odd member mirrors its return noise.
 */
public class RandomContext
{
        public enum Stream
        {
                RETURNS, MORTALITY, LTC, REGIME, STRATIFY
        }

        private final long seed;
        private final boolean antithetic;

        public RandomContext(long seed, boolean antithetic)
        {
                this.seed = seed;
                this.antithetic = antithetic;
        }

        public boolean antithetic()
        {
                return antithetic;
        }

        public int base_index(int scenario)
        {
                return antithetic ? scenario / 2 : scenario;
        }

        public boolean mirrored(int scenario)
        {
                return antithetic && scenario % 2 == 1;
        }

        /**
         * Number of distinct base indexes needed for scenarios scenarios.
         */
        public int base_count(int scenarios)
        {
                return antithetic ? (scenarios + 1) / 2 : scenarios;
        }

        // SplitMix64 finalizer.
        private static long mix(long z)
        {
                z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
                z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
                return z ^ (z >>> 31);
        }

        public long derive_seed(int base_index, Stream stream)
        {
                long z = mix(seed + 0x9e3779b97f4a7c15L);
                z = mix(z + base_index * 0x9e3779b97f4a7c15L);
                return mix(z + (stream.ordinal() + 1) * 0xd1b54a32d192ed03L);
        }

        public RandomGenerator generator(int base_index, Stream stream)
        {
                return new Well19937c(derive_seed(base_index, stream));
        }

        public ScenarioRandom scenario(int scenario)
        {
                int base = base_index(scenario);
                return new ScenarioRandom(base, mirrored(scenario), generator(base, Stream.RETURNS), generator(base, Stream.MORTALITY), generator(base, Stream.LTC), generator(base, Stream.REGIME));
        }

        /**
         * The generators owned by a single scenario.
         */
        public static class ScenarioRandom
        {
                public final int base_index;
                public final boolean mirrored;
                public final RandomGenerator returns;
                public final RandomGenerator mortality;
                public final RandomGenerator ltc;
                public final RandomGenerator regime;

                ScenarioRandom(int base_index, boolean mirrored, RandomGenerator returns, RandomGenerator mortality, RandomGenerator ltc, RandomGenerator regime)
                {
                        this.base_index = base_index;
                        this.mirrored = mirrored;
                        this.returns = returns;
                        this.mortality = mortality;
                        this.ltc = ltc;
                        this.regime = regime;
                }
        }
}
