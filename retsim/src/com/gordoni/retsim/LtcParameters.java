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
 * Long term care modeling inputs for the household.
 */
public class LtcParameters
{
        public final boolean enabled;
        public final double lifetime_probability; // Base probability a person ever needs paid care.
        public final int onset_min_age;
        public final int onset_max_age;
        public final double average_duration; // Years.
        public final double average_annual_cost; // Today's dollars, before care type and regional multipliers.
        public final double inflation; // Care cost inflation.

        public final boolean insured;
        public final double daily_benefit; // Insurance benefit per day of care in today's dollars.
        public final double benefit_years; // Benefit period.
        public final int elimination_days; // Days of care before benefits begin.
        public final boolean inflation_rider; // Benefit grows 3% compound per year.

        public static final double RIDER_GROWTH = 0.03;

        public LtcParameters(boolean enabled, double lifetime_probability, int onset_min_age, int onset_max_age, double average_duration, double average_annual_cost, double inflation, boolean insured, double daily_benefit, double benefit_years, int elimination_days, boolean inflation_rider)
        {
                this.enabled = enabled;
                this.lifetime_probability = lifetime_probability;
                this.onset_min_age = onset_min_age;
                this.onset_max_age = onset_max_age;
                this.average_duration = average_duration;
                this.average_annual_cost = average_annual_cost;
                this.inflation = inflation;
                this.insured = insured;
                this.daily_benefit = daily_benefit;
                this.benefit_years = benefit_years;
                this.elimination_days = elimination_days;
                this.inflation_rider = inflation_rider;
        }

        public static LtcParameters disabled()
        {
                return new LtcParameters(false, 0, 75, 90, 0, 0, 0, false, 0, 0, 0, false);
        }

        public LtcParameters with_enabled(boolean enabled)
        {
                return new LtcParameters(enabled, lifetime_probability, onset_min_age, onset_max_age, average_duration, average_annual_cost, inflation, insured, daily_benefit, benefit_years, elimination_days, inflation_rider);
        }

        public LtcParameters with_insurance(boolean insured)
        {
                return new LtcParameters(enabled, lifetime_probability, onset_min_age, onset_max_age, average_duration, average_annual_cost, inflation, insured, daily_benefit, benefit_years, elimination_days, inflation_rider);
        }
}
