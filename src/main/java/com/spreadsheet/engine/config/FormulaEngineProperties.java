package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings under "formula.engine" in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "formula.engine")
public class FormulaEngineProperties {

    // Upper bound on full-sheet recalculation passes
    private int maxRecalcPasses = 10;

    // Name of the sheet a new workbook starts with
    private String defaultSheetName = "Sheet1";

    public int getMaxRecalcPasses() {
        return maxRecalcPasses;
    }

    public void setMaxRecalcPasses(int maxRecalcPasses) {
        this.maxRecalcPasses = maxRecalcPasses;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public void setDefaultSheetName(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }
}
