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
import java.util.Arrays;
import java.util.List;

/**
 * Small households shared by the tests.
 */
class Fixtures
{
        static Config config()
        {
                Config config = new Config();
                config.workers = 2;
                config.tasks = 8;
                config.iterations = 200;
                config.seed = 42;
                config.safe_withdrawal_rate = false;
                return config;
        }

        /**
         * A single retiree whose Social Security exactly covers essential spending and who owns nothing.
         */
        static Config zero_assets()
        {
                Config config = config();
                config.age = 65;
                config.retirement_age = 65;
                config.life_expectancy = 85;
                config.dynamic_mortality = false;
                config.ss_claim_age = 65;
                config.social_security = 50000 / SocialSecurity.claim_adjustment(65, config.ss_full_retirement_age);
                config.essential_expenses = 50000;
                config.inflation = 0.025;
                config.ss_cola = 0.025;
                config.state = "FL";
                config.guardrails = false;
                return config;
        }

        /**
         * A retiree funded from the tax free bucket only, so withdrawals are untaxed.
         */
        static Config tax_free(double assets)
        {
                Config config = config();
                config.age = 65;
                config.retirement_age = 65;
                config.tax_free = assets;
                config.essential_expenses = 40000;
                config.guardrails = false;
                return config;
        }

        static Person person(int age, Gender gender, IncomeSource... income)
        {
                return new Person(age, age, gender, HealthStatus.GOOD, null, new ArrayList<IncomeSource>(Arrays.asList(income)));
        }

        static SimulationParameters.Builder builder(Household household)
        {
                List<AssetClass> classes = new ArrayList<AssetClass>();
                classes.add(new AssetClass("stocks", 0.07, 0.16));
                return new SimulationParameters.Builder()
                        .household(household)
                        .asset_classes(classes)
                        .correlation(new double[][] {{1}})
                        .allocation(new StaticAllocation(new double[] {1}));
        }
}
