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

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Sampling of long term care episodes.
 */
public class LtcModel
{
        public static final double MAX_PROBABILITY = 0.95;
        public static final double MIN_DURATION = 0.5;

        private static final Map<String, Double> regional = new HashMap<String, Double>();
        static
        {
                regional.put("CA", 1.4);
                regional.put("NY", 1.35);
                regional.put("MA", 1.3);
                regional.put("CT", 1.25);
                regional.put("NJ", 1.2);
                regional.put("FL", 0.9);
                regional.put("TX", 0.8);
                regional.put("GA", 0.85);
                regional.put("NC", 0.9);
                regional.put("AZ", 0.95);
                regional.put("NV", 1.0);
                regional.put("WA", 1.15);
                regional.put("OR", 1.1);
                regional.put("CO", 1.05);
                regional.put("IL", 1.0);
                regional.put("MI", 0.9);
                regional.put("OH", 0.85);
                regional.put("PA", 0.95);
                regional.put("VA", 1.0);
                regional.put("MD", 1.1);
        }

        public static double regional_multiplier(String state)
        {
                Double m = regional.get(state.toUpperCase());
                return m == null ? 1.0 : m;
        }

        public static double lifetime_probability(Person person, LtcParameters ltc)
        {
                double gender = person.gender == Gender.FEMALE ? 1.1 : 0.9;
                return Math.min(MAX_PROBABILITY, ltc.lifetime_probability * gender * person.health.ltc_multiplier);
        }

        /**
         * Sample person's episode, or null if none occurs.
         *
         * Always consumes the same number of draws so the rest of the stream is unaffected by the outcome.
         */
        public static LtcEpisode sample(Person person, LtcParameters ltc, String state, RandomGenerator random)
        {
                double u_occurs = random.nextDouble();
                double u_onset = random.nextDouble();
                double u_duration = random.nextDouble();
                double u_care = random.nextDouble();

                if (u_occurs >= lifetime_probability(person, ltc))
                        return null;
                double onset = ltc.onset_min_age + u_onset * (ltc.onset_max_age - ltc.onset_min_age);
                double gender = person.gender == Gender.FEMALE ? 1.15 : 0.85;
                double duration = Math.max(MIN_DURATION, ltc.average_duration * gender * (0.5 + u_duration));
                CareType care = CareType.select(u_care);
                double cost = ltc.average_annual_cost * care.cost_multiplier * regional_multiplier(state);
                return new LtcEpisode(onset, duration, care, cost);
        }
}
