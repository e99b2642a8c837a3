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

public enum HealthStatus
{
        EXCELLENT(0.7, 0.8),
        GOOD(1.0, 1.0),
        FAIR(1.3, 1.2),
        POOR(1.6, 1.4);

        public final double mortality_multiplier; // Applied to the life table hazard.
        public final double ltc_multiplier; // Applied to the lifetime probability of needing long term care.

        HealthStatus(double mortality_multiplier, double ltc_multiplier)
        {
                this.mortality_multiplier = mortality_multiplier;
                this.ltc_multiplier = ltc_multiplier;
        }

        public static HealthStatus parse(String s)
        {
                for (HealthStatus h : values())
                        if (h.name().equalsIgnoreCase(s))
                                return h;
                throw new IllegalArgumentException("Unknown health status: " + s);
        }
}
