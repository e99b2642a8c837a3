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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.DecimalFormat;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RETSIM
{
        private static final Logger logger = LoggerFactory.getLogger(RETSIM.class);

        public static void usage()
        {
                System.err.println("expecting: [-c C] [-e E] [-y]");
                System.exit(1);
        }

        private static void report(SimulationResult result, boolean yearly)
        {
                DecimalFormat pct = new DecimalFormat("0.0%");
                DecimalFormat dollars = new DecimalFormat("#,##0");
                System.out.println("Probability of success: " + pct.format(result.probability_of_success)
                        + " (raw " + pct.format(result.raw_probability_of_success) + " +/- " + pct.format(result.standard_error) + ")");
                System.out.println("Scenarios: " + result.total + " successful " + result.successful + " failed " + result.failed + " excluded " + result.excluded);
                System.out.println("Ending balance: p10 " + dollars.format(result.ending_balance_p10) + " median " + dollars.format(result.ending_balance_median)
                        + " p90 " + dollars.format(result.ending_balance_p90) + " mean " + dollars.format(result.ending_balance_mean));
                System.out.println("Legacy goal probability: " + pct.format(result.legacy_probability));
                if (!Double.isNaN(result.mean_years_until_depletion))
                        System.out.println("Mean years until depletion: " + new DecimalFormat("0.0").format(result.mean_years_until_depletion));
                if (!Double.isNaN(result.safe_withdrawal_rate))
                        System.out.println("Safe withdrawal rate: " + new DecimalFormat("0.00%").format(result.safe_withdrawal_rate)
                                + (result.safe_withdrawal_rate_low_confidence ? " (low confidence)" : ""));
                GuardrailStatistics g = result.guardrails;
                System.out.println("Guardrail adjustments per scenario: " + new DecimalFormat("0.00").format(g.average_adjustments)
                        + " (cuts " + new DecimalFormat("0.00").format(g.average_cuts) + " raises " + new DecimalFormat("0.00").format(g.average_raises) + ")");
                if (result.ltc_impact != null)
                {
                        LtcImpact ltc = result.ltc_impact;
                        System.out.println("Long term care: probability " + pct.format(ltc.probability) + " average cost " + dollars.format(ltc.average_cost)
                                + " success impact " + pct.format(ltc.success_delta()));
                }
                if (yearly)
                {
                        System.out.println("year age portfolio income withdrawal tax expenses");
                        for (YearlyCashFlow cf : result.cash_flows)
                                System.out.println(cf.year + " " + cf.age + " " + dollars.format(cf.portfolio) + " " + dollars.format(cf.total_income()) + " "
                                        + dollars.format(cf.withdrawal()) + " " + dollars.format(cf.total_tax()) + " " + dollars.format(cf.expenses));
                }
        }

        public static void main(String[] args) throws Exception
        {
                Config config = new Config();
                boolean yearly = false;
                String param_filename = null;
                Map<String, Object> params = new HashMap<String, Object>();

                try
                {
                        for (int idx = 0; idx < args.length; idx++)
                        {
                                String arg = args[idx];
                                if ("-y".equals(arg))
                                        yearly = true;
                                else if ("-c".equals(arg))
                                        param_filename = args[++idx];
                                else if ("-e".equals(arg))
                                        config.load_params(params, args[++idx]);
                                else
                                {
                                        System.err.println("Unrecognized argument");
                                        usage();
                                }
                        }
                }
                catch (ArrayIndexOutOfBoundsException e)
                {
                        System.err.println("Invalid parameters");
                        usage();
                }

                Map<String, Object> file_params = new HashMap<String, Object>();
                if (param_filename != null)
                {
                        String contents;
                        try
                        {
                                contents = new String(Files.readAllBytes(Paths.get(param_filename)), StandardCharsets.UTF_8);
                        }
                        catch (IOException e)
                        {
                                System.err.println("Unable to read " + param_filename + ": " + e.getMessage());
                                System.exit(1);
                                return;
                        }
                        config.load_params(file_params, contents);
                }
                // Command line parameters override those in the file.
                config.applyParams(file_params);
                config.applyParams(params);

                if (config.trace)
                        config.dumpParams();

                SimulationResult result;
                try
                {
                        SimulationParameters sim_params = config.simulation_parameters();
                        result = new ScenarioSet(config).run(sim_params);
                }
                catch (InvalidParameterException e)
                {
                        logger.error("Invalid parameters: {}", e.getMessage());
                        System.exit(2);
                        return;
                }

                report(result, yearly);
        }
}
