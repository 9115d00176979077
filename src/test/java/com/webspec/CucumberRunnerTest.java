package com.webspec;

import io.cucumber.testng.AbstractTestNGCucumberTests;
import io.cucumber.testng.CucumberOptions;
import org.testng.annotations.DataProvider;

/**
 * TestNG entry point for the Cucumber suite.
 *
 * ## Running subsets
 *
 *   All scenarios:
 *     mvn test
 *
 *   Execution only:
 *     mvn test -Dcucumber.filter.tags="@execution"
 *
 *   Analysis only:
 *     mvn test -Dcucumber.filter.tags="@comparison or @alerts"
 *
 * ## Reports
 *   HTML report:  target/cucumber-reports/cucumber-pretty.html
 *   JSON report:  target/cucumber-reports/CucumberTestReport.json
 */
@CucumberOptions(
    features = "src/test/resources/features",
    glue     = {"com.webspec.steps", "com.webspec.hooks"},
    plugin   = {
        "pretty",
        "html:target/cucumber-reports/cucumber-pretty.html",
        "json:target/cucumber-reports/CucumberTestReport.json"
    },
    monochrome = true,
    publish    = false
)
public class CucumberRunnerTest extends AbstractTestNGCucumberTests {

    /** Scenarios share nothing, but the log output is easier to read sequentially. */
    @Override
    @DataProvider(parallel = false)
    public Object[][] scenarios() {
        return super.scenarios();
    }
}
