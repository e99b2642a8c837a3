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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfigTest
{
        private static InvalidParameterException invalid(final Config config)
        {
                return assertThrows(InvalidParameterException.class, () -> config.simulation_parameters());
        }

        @Test
        @DisplayName("Parameters are parsed from name = value lines")
        void loadParams()
        {
                Config config = new Config();
                Map<String, Object> params = new HashMap<String, Object>();
                config.load_params(params, "age = 70 # comment\n\n   \nstate = 'CA'\nallocation = [0.5, 0.5]\ncouple = true\nseed = 123\nlife_expectancy = none\n"
                        + "asset_class_names = ['us', 'intl']\ntotal_assets = 1e6\n");
                config.applyParams(params);
                assertEquals(70, config.age);
                assertEquals("CA", config.state);
                assertArrayEquals(new double[] {0.5, 0.5}, config.allocation);
                assertTrue(config.couple);
                assertEquals(123L, config.seed);
                assertNull(config.life_expectancy);
                assertEquals(Arrays.asList("us", "intl"), config.asset_class_names);
                assertEquals(1e6, config.total_assets);
        }

        @Test
        @DisplayName("Malformed parameters are rejected")
        void badParams()
        {
                final Config config = new Config();
                final Map<String, Object> params = new HashMap<String, Object>();
                assertThrows(IllegalArgumentException.class, () -> config.load_params(params, "no_such_field = 1"));
                assertThrows(IllegalArgumentException.class, () -> config.load_params(params, "state = CA"));
                assertThrows(IllegalArgumentException.class, () -> config.load_params(params, "age = old"));
                assertThrows(IllegalArgumentException.class, () -> config.load_params(params, "age"));
                assertThrows(IllegalArgumentException.class, () -> config.load_params(params, "age = none"));
                params.put("bogus", 1);
                assertThrows(IllegalArgumentException.class, () -> config.applyParams(params));
        }

        @Test
        @DisplayName("A couple becomes a two person household")
        void couple()
        {
                Config config = new Config();
                config.couple = true;
                config.spouse_age = 62;
                config.spouse_social_security = 15000;
                config.pension = 20000;
                config.pension_survivor_fraction = 0.5;
                SimulationParameters params = config.simulation_parameters();
                assertTrue(params.household.is_couple());
                assertEquals(2, params.household.people().size());
                Person spouse = params.household.people().get(1);
                assertEquals(62, spouse.age);
                assertEquals(Gender.FEMALE, spouse.gender);
                assertEquals(1, spouse.income.size());
                assertEquals(IncomeSource.Kind.PENSION, params.household.primary().income.get(0).kind());
        }

        @Test
        @DisplayName("Household errors name the offending field")
        void householdErrors()
        {
                Config gender = new Config();
                gender.gender = "x";
                assertEquals("gender", invalid(gender).getField());

                Config health = new Config();
                health.couple = true;
                health.spouse_health = "dire";
                assertEquals("spouse_health", invalid(health).getField());

                Config total = new Config();
                total.tax_free = 100000;
                total.total_assets = 200000.0;
                assertEquals("total_assets", invalid(total).getField());

                Config allocation = new Config();
                allocation.allocation = new double[] {0.6, 0.6};
                assertEquals("allocation", invalid(allocation).getField());

                Config classes = new Config();
                classes.cagr = new double[] {0.07};
                assertEquals("cagr", invalid(classes).getField());

                Config correlation = new Config();
                correlation.correlation = new double[] {1, 0.5, 0.5};
                assertEquals("correlation", invalid(correlation).getField());

                Config glide = new Config();
                glide.allocation_end = new double[] {0.3, 0.7};
                glide.glide_end_age = 60;
                assertEquals("glide_end_age", invalid(glide).getField());
        }

        @Test
        @DisplayName("Engine settings are validated")
        void validate()
        {
                new Config().validate();

                final Config floor = new Config();
                floor.guardrail_floor = 2;
                assertEquals("guardrail_floor", assertThrows(InvalidParameterException.class, () -> floor.validate()).getField());

                final Config table = new Config();
                table.life_table = "unknown";
                assertEquals("life_table", assertThrows(InvalidParameterException.class, () -> table.validate()).getField());

                final Config swr = new Config();
                swr.swr_max = 0;
                assertEquals("swr_max", assertThrows(InvalidParameterException.class, () -> swr.validate()).getField());
        }

        @Test
        @DisplayName("A glide path moves from the starting to the ending allocation")
        void glidePath()
        {
                Config config = new Config();
                config.allocation_end = new double[] {0.2, 0.8};
                config.glide_start_age = 65;
                config.glide_end_age = 85;
                SimulationParameters params = config.simulation_parameters();
                assertArrayEquals(new double[] {0.6, 0.4}, params.allocation.weights(60), 1e-12);
                assertArrayEquals(new double[] {0.4, 0.6}, params.allocation.weights(75), 1e-12);
                assertArrayEquals(new double[] {0.2, 0.8}, params.allocation.weights(90), 1e-12);
        }

        @Test
        @DisplayName("Parameters can be dumped")
        void dump()
        {
                new Config().dumpParams();
        }
}
