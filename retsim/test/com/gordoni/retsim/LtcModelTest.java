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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LtcModelTest
{
        private static LtcParameters ltc(double probability, boolean insured)
        {
                return new LtcParameters(true, probability, 75, 90, 3.0, 100000, 0.0, insured, 200, 2, 90, false);
        }

        @Test
        @DisplayName("Lifetime probability depends on gender and health and is capped")
        void lifetimeProbability()
        {
                Person man = Fixtures.person(65, Gender.MALE);
                Person woman = Fixtures.person(65, Gender.FEMALE);
                assertEquals(0.45, LtcModel.lifetime_probability(man, ltc(0.5, false)), 1e-12);
                assertEquals(0.55, LtcModel.lifetime_probability(woman, ltc(0.5, false)), 1e-12);
                Person poor = new Person(65, 65, Gender.FEMALE, HealthStatus.POOR, null, man.income);
                assertEquals(LtcModel.MAX_PROBABILITY, LtcModel.lifetime_probability(poor, ltc(1.0, false)));
        }

        @Test
        @DisplayName("Sampled episodes fall inside the onset window")
        void sampledEpisodes()
        {
                Person p = Fixtures.person(65, Gender.FEMALE);
                int occurred = 0;
                for (int i = 0; i < 1000; i++)
                {
                        LtcEpisode e = LtcModel.sample(p, ltc(0.5, false), "TX", new Well19937c(i));
                        if (e == null)
                                continue;
                        occurred++;
                        assertTrue(e.onset_age >= 75 && e.onset_age <= 90);
                        assertTrue(e.duration >= LtcModel.MIN_DURATION);
                        assertEquals(100000 * e.care_type.cost_multiplier * 0.8, e.annual_cost, 1e-6);
                }
                assertEquals(550, occurred, 60);
                assertNull(LtcModel.sample(p, ltc(0, false), "TX", new Well19937c(1)));
        }

        @Test
        @DisplayName("Care types are chosen by weight")
        void careTypes()
        {
                assertSame(CareType.HOME, CareType.select(0.0));
                assertSame(CareType.ASSISTED, CareType.select(0.5));
                assertSame(CareType.NURSING, CareType.select(0.9));
                assertSame(CareType.MEMORY, CareType.select(0.99));
        }

        @Test
        @DisplayName("Care costs only while care is received and ends at death")
        void episodeCost()
        {
                LtcEpisode e = new LtcEpisode(80.5, 2.0, CareType.NURSING, 100000);
                LtcParameters params = ltc(0.5, false);
                assertEquals(0, e.cost(0, 79, 95, params));
                assertEquals(50000, e.cost(0, 80, 95, params), 1e-6);
                assertEquals(100000, e.cost(0, 81, 95, params), 1e-6);
                assertEquals(50000, e.cost(0, 82, 95, params), 1e-6);
                assertEquals(0, e.cost(0, 81, 81, params));
        }

        @Test
        @DisplayName("Insurance pays after the elimination period up to the daily benefit")
        void insurance()
        {
                LtcEpisode e = new LtcEpisode(80.0, 3.0, CareType.NURSING, 100000);
                LtcParameters insured = ltc(0.5, true);
                double benefit = 200 * 365.0;
                double first = e.cost(0, 80, 95, insured);
                assertEquals(100000 - (1 - 90 / 365.0) * benefit, first, 1e-6);
                assertEquals(100000 - benefit, e.cost(0, 81, 95, insured), 1e-6);
                // Benefit period of two years runs out 90 days into the third year.
                assertEquals(100000 - 90 / 365.0 * benefit, e.cost(0, 82, 95, insured), 1e-6);

                LtcEpisode cheap = new LtcEpisode(80.0, 3.0, CareType.HOME, 10000);
                assertEquals(0, cheap.cost(0, 81, 95, insured), 1e-9);
        }

        @Test
        @DisplayName("Long term care can be switched on")
        void disabled()
        {
                LtcParameters off = LtcParameters.disabled();
                assertNotNull(off);
                assertFalse(off.enabled);
                assertTrue(off.with_enabled(true).enabled);
        }
}
