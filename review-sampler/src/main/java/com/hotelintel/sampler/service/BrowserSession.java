package com.hotelintel.sampler.service;

import com.hotelintel.sampler.driver.PageDriver;
import org.springframework.beans.factory.ObjectProvider;

final class BrowserSession {

    private BrowserSession() {
    }

    /** The page driver, or an error naming the switch that disabled it. */
    static PageDriver require(ObjectProvider<PageDriver> provider) {
        PageDriver driver = provider.getIfAvailable();
        if (driver == null) {
            throw new IllegalStateException("No page driver available; is sampler.browser.enabled=false?");
        }
        return driver;
    }
}
