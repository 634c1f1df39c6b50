package com.testconductor.browser.selenium;

import com.testconductor.core.ConductorConfig;
import io.github.bonigarcia.wdm.WebDriverManager;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Creates the ChromeDriver that backs a {@link SeleniumBrowserContext}.
 *
 * ## Headless mode
 * Controlled by {@code CONDUCTOR_HEADLESS} (default: true). Extensions load in the
 * new headless mode, so a wallet can be tested headless as well.
 *
 * ## Wallet extension
 * When {@code CONDUCTOR_WALLET_EXTENSION_PATH} points at an unpacked extension it is
 * loaded into the profile. Installing and onboarding the wallet is up to the tasks.
 *
 * Pages load with the eager strategy: {@code get()} returns at DOMContentLoaded
 * and the stronger load states are polled afterwards.
 */
public final class DriverFactory {

    private static final Logger log = LoggerFactory.getLogger(DriverFactory.class);
    private static final Duration PAGE_LOAD_TIMEOUT = Duration.ofSeconds(60);

    private DriverFactory() {}

    public static WebDriver createChrome(ConductorConfig config) {
        WebDriverManager.chromedriver().setup();

        ChromeOptions options = new ChromeOptions();
        if (config.isHeadless()) {
            options.addArguments("--headless=new");
            log.info("DriverFactory: Running in headless mode");
        } else {
            log.info("DriverFactory: Running with visible browser");
        }

        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1440,900",
            "--disable-search-engine-choice-screen",
            "--disable-features=PrivacySandboxSettings4"
        );

        Path extension = config.getWalletExtensionPath();
        if (extension != null) {
            String dir = extension.toAbsolutePath().toString();
            options.addArguments("--disable-extensions-except=" + dir, "--load-extension=" + dir);
            log.info("DriverFactory: Loading wallet extension from {}", dir);
        }
        options.setPageLoadStrategy(PageLoadStrategy.EAGER);

        WebDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(PAGE_LOAD_TIMEOUT);
        log.info("DriverFactory: WebDriver created");
        return driver;
    }

    /**
     * Quits the driver, logging rather than propagating teardown exceptions.
     */
    public static void quit(WebDriver driver) {
        if (driver != null) {
            try {
                driver.quit();
                log.debug("DriverFactory: WebDriver quit successfully");
            } catch (RuntimeException e) {
                log.warn("DriverFactory: Exception during driver quit: {}", e.getMessage());
            }
        }
    }
}
