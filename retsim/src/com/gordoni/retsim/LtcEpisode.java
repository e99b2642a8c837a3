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
 * A single long term care need: when it starts, how long it lasts, and what it costs.
 */
public class LtcEpisode
{
        public final double onset_age;
        public final double duration; // Years.
        public final CareType care_type;
        public final double annual_cost; // Today's dollars, after care type and regional multipliers.

        public LtcEpisode(double onset_age, double duration, CareType care_type, double annual_cost)
        {
                this.onset_age = onset_age;
                this.duration = duration;
                this.care_type = care_type;
                this.annual_cost = annual_cost;
        }

        private static double overlap(double a0, double a1, double b0, double b1)
        {
                return Math.max(0, Math.min(a1, b1) - Math.max(a0, b0));
        }

        /**
         * Fraction of the year of age age spent receiving care. Care ends at death.
         */
        public double active_fraction(int age, int death_age)
        {
                return overlap(age, age + 1, onset_age, Math.min(onset_age + duration, death_age));
        }

        /**
         * Nominal out of pocket cost during simulation year year, when the person is age. Insurance, if any, pays
         * its daily benefit for care after the elimination period until the benefit period is used up, but never more
         * than the cost of the care.
         */
        public double cost(int year, int age, int death_age, LtcParameters ltc)
        {
                double active = active_fraction(age, death_age);
                if (active == 0)
                        return 0;
                double cost_rate = annual_cost * Math.pow(1 + ltc.inflation, year);
                double cost = active * cost_rate;
                if (!ltc.insured)
                        return cost;
                double start = onset_age + ltc.elimination_days / 365.0;
                double end = Math.min(start + ltc.benefit_years, Math.min(onset_age + duration, death_age));
                double covered = overlap(age, age + 1, start, end);
                double benefit_rate = ltc.daily_benefit * 365 * (ltc.inflation_rider ? Math.pow(1 + LtcParameters.RIDER_GROWTH, year) : 1);
                return Math.max(0, cost - covered * Math.min(benefit_rate, cost_rate));
        }
}
