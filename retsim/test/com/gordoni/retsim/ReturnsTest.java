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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReturnsTest
{
        @Test
        @DisplayName("Geometric and arithmetic mean conversions are inverses")
        void conversionsRoundTrip()
        {
                double aagr = Returns.cagr2aagr(0.07, 0.16);
                assertTrue(aagr > 0.07);
                assertEquals(0.07, Returns.aagr2cagr(aagr, 0.16), 1e-12);
                assertEquals(0.04, Returns.cagr2aagr(0.04, 0), 1e-12);
        }

        @Test
        @DisplayName("Draws depend only on the seed and scenario index")
        void drawsAreReproducible()
        {
                Config config = Fixtures.config();
                SimulationParameters params = config.simulation_parameters();
                Returns a = new Returns(params, config, new RandomContext(7, true), 50);
                Returns b = new Returns(params, config, new RandomContext(7, true), 50);
                RandomContext ra = new RandomContext(7, true);
                RandomContext rb = new RandomContext(7, true);
                for (int year = 0; year < 40; year++)
                {
                        double[] x = a.draw(ra.scenario(13), year, MarketRegime.NORMAL).returns;
                        double[] y = b.draw(rb.scenario(13), year, MarketRegime.NORMAL).returns;
                        assertEquals(x[0], y[0]);
                        assertEquals(x[1], y[1]);
                }
        }

        @Test
        @DisplayName("Antithetic partners see mirrored return noise")
        void antitheticPairsMirror()
        {
                Config config = Fixtures.config();
                SimulationParameters params = config.simulation_parameters();
                RandomContext random = new RandomContext(3, true);
                Returns returns = new Returns(params, config, random, 20);
                RandomContext.ScenarioRandom even = random.scenario(4);
                RandomContext.ScenarioRandom odd = random.scenario(5);
                assertEquals(even.base_index, odd.base_index);
                for (int year = 0; year < 40; year++)
                {
                        double[] x = returns.draw(even, year, MarketRegime.NORMAL).returns;
                        double[] y = returns.draw(odd, year, MarketRegime.NORMAL).returns;
                        for (int a = 0; a < returns.classes; a++)
                        {
                                double mean = returns.mean(a, MarketRegime.NORMAL);
                                assertEquals(x[a] - mean, -(y[a] - mean), 1e-12);
                        }
                }
        }

        @Test
        @DisplayName("Stratified years place exactly one scenario in each probability bin")
        void stratifiedYearsCoverEveryBin()
        {
                Config config = Fixtures.config();
                config.antithetic = false;
                SimulationParameters params = config.simulation_parameters();
                int n = 64;
                RandomContext random = new RandomContext(11, false);
                Returns returns = new Returns(params, config, random, n);
                NormalDistribution normal = new NormalDistribution(0, 1);
                for (int year = 0; year < 3; year++)
                {
                        Set<Integer> bins = new HashSet<Integer>();
                        for (int i = 0; i < n; i++)
                        {
                                double r = returns.draw(random.scenario(i), year, MarketRegime.NORMAL).returns[0];
                                double z = (r - returns.mean(0, MarketRegime.NORMAL)) / returns.sd(0, MarketRegime.NORMAL);
                                bins.add((int) Math.floor(normal.cumulativeProbability(z) * n));
                        }
                        assertEquals(n, bins.size());
                }
        }

        @Test
        @DisplayName("Losses are capped at the whole investment")
        void returnsNeverBelowMinusOne()
        {
                Config config = Fixtures.config();
                config.asset_class_names = Arrays.asList("wild");
                config.cagr = new double[] {0.0};
                config.volatility = new double[] {3.0};
                config.allocation = new double[] {1.0};
                SimulationParameters params = config.simulation_parameters();
                RandomContext random = new RandomContext(5, true);
                Returns returns = new Returns(params, config, random, 100);
                for (int i = 0; i < 100; i++)
                        for (int year = 0; year < 40; year++)
                                assertTrue(returns.draw(random.scenario(i), year, MarketRegime.NORMAL).returns[0] >= -1);
        }

        @Test
        @DisplayName("Regimes follow the configured transition probabilities")
        void regimeTransitions()
        {
                Config config = Fixtures.config();
                SimulationParameters params = config.simulation_parameters();
                RandomGenerator rng = new Well19937c(1);

                Returns off = new Returns(params, config, new RandomContext(1, true), 10);
                assertSame(MarketRegime.NORMAL, off.next_regime(MarketRegime.STRESS, rng));

                config.regime_switching = true;
                config.regime_normal_to_stress = 1;
                config.regime_stress_to_normal = 0;
                Returns sticky = new Returns(params, config, new RandomContext(1, true), 10);
                MarketRegime regime = MarketRegime.NORMAL;
                for (int y = 0; y < 10; y++)
                {
                        regime = sticky.next_regime(regime, rng);
                        assertSame(MarketRegime.STRESS, regime);
                }
                assertTrue(sticky.mean(0, MarketRegime.STRESS) < sticky.mean(0, MarketRegime.NORMAL));
                assertTrue(sticky.sd(0, MarketRegime.STRESS) > sticky.sd(0, MarketRegime.NORMAL));
        }

        @Test
        @DisplayName("Expected control statistic is the allocation weighted mean return")
        void expectedControlStatistic()
        {
                Config config = Fixtures.config();
                SimulationParameters params = config.simulation_parameters();
                Returns returns = new Returns(params, config, new RandomContext(1, true), 10);
                double expected = 0.6 * returns.aagr[0] + 0.4 * returns.aagr[1];
                assertEquals(expected, returns.expected_control_statistic(params.allocation, 65), 1e-12);
        }
}
