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

/**
 * Summary of one trial.
 */
public class ScenarioResult
{
        public final int index;
        public final boolean valid; // False if a non-finite value arose.
        public final int invalid_year;
        public final boolean success; // Every year's need was met.
        public final int depletion_year; // First year with an unmet need, or -1.
        public final int horizon; // Years simulated.
        public final double ending_balance;
        public final double legacy_target; // Legacy goal in end of horizon dollars.

        public final int cuts;
        public final int raises;
        public final int capital_preservation_years;
        public final int prosperity_years;
        public final double min_multiplier;
        public final double max_multiplier;

        public final boolean ltc_occurred;
        public final double ltc_cost;

        public final double control_statistic;

        public final List<YearlyCashFlow> cash_flows; // Only when recorded.

        public ScenarioResult(int index, boolean valid, int invalid_year, boolean success, int depletion_year, int horizon, double ending_balance, double legacy_target, int cuts, int raises, int capital_preservation_years, int prosperity_years, double min_multiplier, double max_multiplier, boolean ltc_occurred, double ltc_cost, double control_statistic, List<YearlyCashFlow> cash_flows)
        {
                this.index = index;
                this.valid = valid;
                this.invalid_year = invalid_year;
                this.success = success;
                this.depletion_year = depletion_year;
                this.horizon = horizon;
                this.ending_balance = ending_balance;
                this.legacy_target = legacy_target;
                this.cuts = cuts;
                this.raises = raises;
                this.capital_preservation_years = capital_preservation_years;
                this.prosperity_years = prosperity_years;
                this.min_multiplier = min_multiplier;
                this.max_multiplier = max_multiplier;
                this.ltc_occurred = ltc_occurred;
                this.ltc_cost = ltc_cost;
                this.control_statistic = control_statistic;
                this.cash_flows = cash_flows;
        }

        public boolean legacy_met()
        {
                return valid && success && ending_balance >= legacy_target;
        }
}
