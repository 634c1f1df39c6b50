package com.testconductor;

import io.cucumber.testng.AbstractTestNGCucumberTests;
import io.cucumber.testng.CucumberOptions;
import org.testng.annotations.DataProvider;

/**
 * TestNG entry point for the Cucumber scenarios.
 *
 * ## Running subsets
 *
 *   All scenarios:
 *     mvn test
 *
 *   Scheduling only:
 *     mvn test -Dcucumber.filter.tags="@scheduling"
 *
 *   Wallet popups only:
 *     mvn test -Dcucumber.filter.tags="@wallet"
 *
 * Every scenario runs against the in-memory Driver, so no browser is needed.
 *
 * ## Reports
 *   HTML report:  target/cucumber-reports/cucumber-pretty.html
 *   JSON report:  target/cucumber-reports/CucumberTestReport.json
 */
@CucumberOptions(
    features = "classpath:features",
    glue     = {"com.testconductor.steps", "com.testconductor.hooks"},
    plugin   = {
        "pretty",
        "html:target/cucumber-reports/cucumber-pretty.html",
        "json:target/cucumber-reports/CucumberTestReport.json"
    },
    monochrome = true,
    publish    = false
)
public class RunCucumberTest extends AbstractTestNGCucumberTests {

    @Override
    @DataProvider(parallel = false)
    public Object[][] scenarios() {
        return super.scenarios();
    }
}
