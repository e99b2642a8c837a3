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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate outcome of a run. Statistics are over the valid scenarios; numerically unstable scenarios are counted
 * separately as excluded.
 */
public class SimulationResult
{
        public final double probability_of_success; // Control variate adjusted when enabled.
        public final double raw_probability_of_success;
        public final double standard_error;

        public final double ending_balance_p10;
        public final double ending_balance_median;
        public final double ending_balance_p90;
        public final double ending_balance_mean;
        public final double legacy_probability;

        public final double safe_withdrawal_rate; // NaN if not computed.
        public final boolean safe_withdrawal_rate_low_confidence;

        public final double mean_years_until_depletion; // Over failed scenarios, or NaN if none failed.

        public final int successful;
        public final int failed;
        public final int excluded;
        public final int total;

        public final List<YearlyCashFlow> cash_flows; // Representative scenario: the one with the median ending balance.
        public final GuardrailStatistics guardrails;
        public final LtcImpact ltc_impact; // Null when long term care is not modeled.

        public SimulationResult(double probability_of_success, double raw_probability_of_success, double standard_error, double ending_balance_p10, double ending_balance_median, double ending_balance_p90, double ending_balance_mean, double legacy_probability, double safe_withdrawal_rate, boolean safe_withdrawal_rate_low_confidence, double mean_years_until_depletion, int successful, int failed, int excluded, int total, List<YearlyCashFlow> cash_flows, GuardrailStatistics guardrails, LtcImpact ltc_impact)
        {
                this.probability_of_success = probability_of_success;
                this.raw_probability_of_success = raw_probability_of_success;
                this.standard_error = standard_error;
                this.ending_balance_p10 = ending_balance_p10;
                this.ending_balance_median = ending_balance_median;
                this.ending_balance_p90 = ending_balance_p90;
                this.ending_balance_mean = ending_balance_mean;
                this.legacy_probability = legacy_probability;
                this.safe_withdrawal_rate = safe_withdrawal_rate;
                this.safe_withdrawal_rate_low_confidence = safe_withdrawal_rate_low_confidence;
                this.mean_years_until_depletion = mean_years_until_depletion;
                this.successful = successful;
                this.failed = failed;
                this.excluded = excluded;
                this.total = total;
                this.cash_flows = Collections.unmodifiableList(new ArrayList<YearlyCashFlow>(cash_flows));
                this.guardrails = guardrails;
                this.ltc_impact = ltc_impact;
        }
}
