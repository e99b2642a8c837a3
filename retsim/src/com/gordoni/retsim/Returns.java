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

import java.util.List;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;

/**
 * Correlated normally distributed annual returns for each asset class.
 *
 * Each class is sampled with its arithmetic mean, cagr2aagr(cagr, volatility), so that compounding reproduces the
 * requested compound growth rate. Correlation comes from the Cholesky factor of the correlation matrix applied to a
 * vector of independent standard normals. The independent normals for the first stratified_years years may be taken
 * from a Latin hypercube across scenarios, and may be mirrored for the odd member of an antithetic pair.
 */
public class Returns
{
        private final Config config;

        public final int classes;
        public final double[] aagr;
        public final double[] volatility;
        private final double[][] cholesky;

        private final int stratified_years;
        private final double[][][] stratified; // [base index][year][class] standard normals.

        public static double cagr2aagr(double cagr, double volatility)
        {
                return cagr + volatility * volatility / 2;
        }

        public static double aagr2cagr(double aagr, double volatility)
        {
                return aagr - volatility * volatility / 2;
        }

        public Returns(SimulationParameters params, Config config, RandomContext random, int scenarios)
        {
                this.config = config;

                List<AssetClass> acs = params.asset_classes;
                classes = acs.size();
                aagr = new double[classes];
                volatility = new double[classes];
                for (int a = 0; a < classes; a++)
                {
                        aagr[a] = cagr2aagr(acs.get(a).cagr, acs.get(a).volatility);
                        volatility[a] = acs.get(a).volatility;
                }
                cholesky = Utils.cholesky_decompose(params.correlation());

                if (config.stratified_sampling)
                {
                        stratified_years = config.stratified_years;
                        stratified = latin_hypercube(random, random.base_count(scenarios), stratified_years, classes);
                }
                else
                {
                        stratified_years = 0;
                        stratified = null;
                }
        }

        // For each year and class split [0, 1) into one equal probability bin per scenario, place one uniform in each,
        // and assign the bins to scenarios in a random order.
        private static double[][][] latin_hypercube(RandomContext random, int n, int years, int classes)
        {
                NormalDistribution normal = new NormalDistribution(0, 1);
                double[][][] z = new double[n][years][classes];
                int[] perm = new int[n];
                for (int y = 0; y < years; y++)
                        for (int a = 0; a < classes; a++)
                        {
                                RandomGenerator rng = random.generator(y * classes + a, RandomContext.Stream.STRATIFY);
                                for (int i = 0; i < n; i++)
                                        perm[i] = i;
                                MathArrays.shuffle(perm, rng);
                                for (int i = 0; i < n; i++)
                                {
                                        double u = (perm[i] + rng.nextDouble()) / n;
                                        u = Math.max(1e-12, Math.min(1 - 1e-12, u));
                                        z[i][y][a] = normal.inverseCumulativeProbability(u);
                                }
                        }
                return z;
        }

        /**
         * Regime for year given the previous year's regime. Every scenario starts the year before the simulation in
         * the normal regime.
         */
        public MarketRegime next_regime(MarketRegime previous, RandomGenerator rng)
        {
                if (!config.regime_switching)
                        return MarketRegime.NORMAL;
                double u = rng.nextDouble();
                if (previous == MarketRegime.NORMAL)
                        return u < config.regime_normal_to_stress ? MarketRegime.STRESS : MarketRegime.NORMAL;
                else
                        return u < config.regime_stress_to_normal ? MarketRegime.NORMAL : MarketRegime.STRESS;
        }

        public double mean(int a, MarketRegime regime)
        {
                if (regime == MarketRegime.STRESS)
                        return aagr[a] - config.regime_stress_mean_shift * volatility[a];
                return aagr[a];
        }

        public double sd(int a, MarketRegime regime)
        {
                if (regime == MarketRegime.STRESS)
                        return volatility[a] * config.regime_stress_vol_multiplier;
                return volatility[a];
        }

        public ReturnDraw draw(RandomContext.ScenarioRandom sr, int year, MarketRegime regime)
        {
                double[] z = new double[classes];
                for (int a = 0; a < classes; a++)
                {
                        if (year < stratified_years)
                                z[a] = stratified[sr.base_index][year][a];
                        else
                                z[a] = sr.returns.nextGaussian();
                        if (sr.mirrored)
                                z[a] = -z[a];
                }
                double[] correlated = Utils.matrix_vector_product(cholesky, z);
                double[] r = new double[classes];
                for (int a = 0; a < classes; a++)
                        r[a] = Math.max(-1, mean(a, regime) + sd(a, regime) * correlated[a]); // Can't lose more than everything.
                return new ReturnDraw(year, regime, r);
        }

        /**
         * Expected value of the control statistic: the mean over the first control_variate_years years of the invested
         * portfolio's arithmetic return, for a primary person starting at age.
         */
        public double expected_control_statistic(AllocationPolicy allocation, int age)
        {
                int years = config.control_variate_years;
                double p_stress = 0; // Probability the previous year was a stress year.
                double total = 0;
                for (int y = 0; y < years; y++)
                {
                        if (config.regime_switching)
                                p_stress = p_stress * (1 - config.regime_stress_to_normal) + (1 - p_stress) * config.regime_normal_to_stress;
                        double[] w = allocation.weights(age + y);
                        for (int a = 0; a < classes; a++)
                                total += w[a] * ((1 - p_stress) * mean(a, MarketRegime.NORMAL) + p_stress * mean(a, MarketRegime.STRESS));
                }
                return total / years;
        }
}
