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

/**
 * Guyton-Klinger guardrail spending control.
 *
 * Each year the current withdrawal rate is compared with the initial withdrawal rate. Above the upper guardrail the
 * discretionary budget is cut, below the lower guardrail it is raised. Only discretionary spending is scaled, and the
 * scaling stays within [guardrail_floor, guardrail_ceiling].
 */
public class Guardrails
{
        private final Config config;

        private double initial_rate; // NaN until known.
        private double multiplier = 1;
        private SpendingState state = SpendingState.NORMAL;
        private int cuts = 0;
        private int raises = 0;

        /**
         * @param initial_rate reference withdrawal rate, or 0 to take the rate of the first year with a withdrawal
         */
        public Guardrails(Config config, double initial_rate)
        {
                this.config = config;
                this.initial_rate = initial_rate > 0 ? initial_rate : Double.NaN;
        }

        public double multiplier()
        {
                return multiplier;
        }

        public SpendingState state()
        {
                return state;
        }

        public int cuts()
        {
                return cuts;
        }

        public int raises()
        {
                return raises;
        }

        public double initial_rate()
        {
                return initial_rate;
        }

        /**
         * @param withdrawal the withdrawal needed at the current spending level
         * @param portfolio the portfolio balance it will be drawn from
         * @param years_remaining years left in the planning horizon
         * @return the new state
         */
        public SpendingState update(double withdrawal, double portfolio, int years_remaining)
        {
                state = SpendingState.NORMAL;
                if (portfolio <= 0 || withdrawal <= 0)
                        return state;
                double rate = withdrawal / portfolio;
                if (Double.isNaN(initial_rate))
                {
                        initial_rate = rate;
                        return state;
                }

                if (rate > initial_rate * (1 + config.guardrail_upper))
                {
                        if (years_remaining > config.capital_preservation_min_years)
                        {
                                state = SpendingState.CAPITAL_PRESERVATION;
                                double m = Math.max(config.guardrail_floor, multiplier * (1 - config.guardrail_cut));
                                if (m != multiplier)
                                        cuts++;
                                multiplier = m;
                        }
                }
                else if (rate < initial_rate * (1 - config.guardrail_lower))
                {
                        state = SpendingState.PROSPERITY;
                        double m = Math.min(config.guardrail_ceiling, multiplier * (1 + config.guardrail_raise));
                        if (m != multiplier)
                                raises++;
                        multiplier = m;
                }
                return state;
        }
}
