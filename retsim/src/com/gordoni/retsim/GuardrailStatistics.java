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

public class GuardrailStatistics
{
        public final double average_adjustments; // Per scenario.
        public final double average_cuts;
        public final double average_raises;
        public final double scenarios_adjusted; // Fraction of scenarios with at least one adjustment.
        public final double capital_preservation_years; // Average per scenario.
        public final double prosperity_years;
        public final double min_multiplier; // Lowest discretionary multiplier seen in any scenario year.
        public final double max_multiplier;

        public GuardrailStatistics(double average_adjustments, double average_cuts, double average_raises, double scenarios_adjusted, double capital_preservation_years, double prosperity_years, double min_multiplier, double max_multiplier)
        {
                this.average_adjustments = average_adjustments;
                this.average_cuts = average_cuts;
                this.average_raises = average_raises;
                this.scenarios_adjusted = scenarios_adjusted;
                this.capital_preservation_years = capital_preservation_years;
                this.prosperity_years = prosperity_years;
                this.min_multiplier = min_multiplier;
                this.max_multiplier = max_multiplier;
        }

        public static GuardrailStatistics of(ScenarioResult[] results)
        {
                int n = 0;
                int cuts = 0;
                int raises = 0;
                int adjusted = 0;
                int cp = 0;
                int prosperity = 0;
                double min = 1;
                double max = 1;
                for (ScenarioResult r : results)
                {
                        if (!r.valid)
                                continue;
                        n++;
                        cuts += r.cuts;
                        raises += r.raises;
                        if (r.cuts + r.raises > 0)
                                adjusted++;
                        cp += r.capital_preservation_years;
                        prosperity += r.prosperity_years;
                        min = Math.min(min, r.min_multiplier);
                        max = Math.max(max, r.max_multiplier);
                }
                if (n == 0)
                        return new GuardrailStatistics(0, 0, 0, 0, 0, 0, 1, 1);
                return new GuardrailStatistics((cuts + raises) / (double) n, cuts / (double) n, raises / (double) n, adjusted / (double) n, cp / (double) n, prosperity / (double) n, min, max);
        }
}
