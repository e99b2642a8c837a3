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

public class SocialSecurity extends IncomeSource
{
        public static final int MIN_CLAIM_AGE = 62;
        public static final int MAX_CLAIM_AGE = 70;

        public final double fra_benefit; // Annual benefit at full retirement age in today's dollars.
        public final int claim_age;
        public final int full_retirement_age;

        public SocialSecurity(double fra_benefit, int claim_age, int full_retirement_age)
        {
                this.fra_benefit = fra_benefit;
                this.claim_age = Math.max(MIN_CLAIM_AGE, Math.min(MAX_CLAIM_AGE, claim_age));
                this.full_retirement_age = full_retirement_age;
        }

        /**
         * Multiple of the full retirement age benefit received when claiming at claim_age.
         *
         * Early claiming loses 5/9 of 1% per month for the first 36 months and 5/12 of 1% per month beyond that.
         * Delayed claiming earns 8% per year up to age 70.
         */
        public static double claim_adjustment(int claim_age, int full_retirement_age)
        {
                claim_age = Math.max(MIN_CLAIM_AGE, Math.min(MAX_CLAIM_AGE, claim_age));
                if (claim_age < full_retirement_age)
                {
                        int months = (full_retirement_age - claim_age) * 12;
                        int first = Math.min(months, 36);
                        int rest = months - first;
                        return 1 - first * (5.0 / 9 / 100) - rest * (5.0 / 12 / 100);
                }
                else
                        return 1 + 0.08 * (claim_age - full_retirement_age);
        }

        public Kind kind()
        {
                return Kind.SOCIAL_SECURITY;
        }

        public double benefit(Person owner, int year, SimulationParameters params)
        {
                if (owner.age + year < claim_age)
                        return 0;
                return fra_benefit * claim_adjustment(claim_age, full_retirement_age) * Math.pow(1 + params.ss_cola, year);
        }

        // The survivor receives the larger of the two benefits; the projector takes the maximum.
        @Override
        public double survivor_benefit(Person owner, int year, SimulationParameters params)
        {
                return benefit(owner, year, params);
        }
}
