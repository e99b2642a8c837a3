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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimulationParametersTest
{
        private static SimulationParameters.Builder builder()
        {
                return Fixtures.builder(new SingleHousehold(Fixtures.person(65, Gender.MALE)));
        }

        private static String field(final SimulationParameters.Builder b)
        {
                return assertThrows(InvalidParameterException.class, () -> b.build()).getField();
        }

        @Test
        @DisplayName("Negative or non-finite amounts are rejected")
        void amounts()
        {
                assertEquals("cash", field(builder().assets(new AssetBuckets(0, 0, 0, 0, -1))));
                assertEquals("tax_free", field(builder().assets(new AssetBuckets(0, Double.NaN, 0, 0, 0))));
                assertEquals("capital_gains_basis", field(builder().assets(new AssetBuckets(0, 0, 100, 200, 0))));
                assertEquals("essential_expenses", field(builder().essential_expenses(-5)));
                assertEquals("inflation", field(builder().general_inflation(-1)));
                assertEquals("survivor_expense_fraction", field(builder().survivor_expense_fraction(1.5)));
                assertEquals("iterations", field(builder().iterations(0)));
                assertEquals("social_security", field(Fixtures.builder(new SingleHousehold(Fixtures.person(65, Gender.MALE, new SocialSecurity(-1, 67, 67))))));
                assertEquals("household", field(new SimulationParameters.Builder()));
        }

        @Test
        @DisplayName("The correlation matrix must be a valid correlation matrix")
        void correlation()
        {
                List<AssetClass> two = Arrays.asList(new AssetClass("a", 0.05, 0.1), new AssetClass("b", 0.03, 0.05));
                SimulationParameters.Builder b = builder().asset_classes(two).allocation(new StaticAllocation(new double[] {0.5, 0.5}));
                assertEquals("correlation", field(b.correlation(new double[][] {{1, 0}})));
                assertEquals("correlation", field(b.correlation(new double[][] {{1, 0.5}, {0.4, 1}})));
                assertEquals("correlation", field(b.correlation(new double[][] {{0.9, 0}, {0, 1}})));
                assertEquals("correlation", field(b.correlation(new double[][] {{1, 1}, {1, 1}})));
                b.correlation(new double[][] {{1, -0.3}, {-0.3, 1}}).build();
        }

        @Test
        @DisplayName("Callers cannot change the correlation matrix or allocation weights of built parameters")
        void immutable()
        {
                double[][] corr = {{1, 0.2}, {0.2, 1}};
                double[] mix = {0.6, 0.4};
                List<AssetClass> two = Arrays.asList(new AssetClass("a", 0.05, 0.1), new AssetClass("b", 0.03, 0.05));
                SimulationParameters p = builder().asset_classes(two).correlation(corr).allocation(new StaticAllocation(mix)).build();
                corr[0][1] = 0.9;
                mix[0] = 0;
                p.correlation()[1][0] = 0.7;
                p.allocation.weights(65)[0] = 0.1;
                p.allocation.anchors()[0][1] = 0.1;
                assertArrayEquals(new double[] {1, 0.2}, p.correlation()[0]);
                assertArrayEquals(new double[] {0.2, 1}, p.correlation()[1]);
                assertArrayEquals(new double[] {0.6, 0.4}, p.allocation.weights(65));

                LinearGlidePath glide = new LinearGlidePath(new double[] {0.8, 0.2}, new double[] {0.4, 0.6}, 60, 80);
                glide.anchors()[0][0] = 0;
                assertArrayEquals(new double[] {0.8, 0.2}, glide.weights(60));
        }

        @Test
        @DisplayName("Long term care settings are checked only when enabled")
        void ltc()
        {
                LtcParameters bad = new LtcParameters(false, 2.0, 75, 90, 3, 100000, 0.04, false, 200, 3, 90, true);
                builder().ltc(bad).build();
                assertEquals("ltc_probability", field(builder().ltc(bad.with_enabled(true))));
                LtcParameters window = new LtcParameters(true, 0.5, 90, 75, 3, 100000, 0.04, false, 200, 3, 90, true);
                assertEquals("ltc_onset_max_age", field(builder().ltc(window)));
        }

        @Test
        @DisplayName("Copies keep every setting")
        void toBuilder()
        {
                SimulationParameters p = builder().essential_expenses(30000).state("ca").seed(9).iterations(77).build();
                assertEquals("CA", p.state);
                SimulationParameters q = p.to_builder().seed(10).build();
                assertEquals(10, q.seed);
                assertEquals(77, q.iterations);
                assertEquals(30000, q.essential_expenses);
                assertEquals("CA", q.state);
                assertEquals(p.household, q.household);
        }
}
