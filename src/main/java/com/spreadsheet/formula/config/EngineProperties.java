package com.spreadsheet.formula.config;

import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.engine.ReferenceCodec;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings applied to every workbook's formula engine ("formula.engine.*").
 */
@ConfigurationProperties(prefix = "formula.engine")
public class EngineProperties {

    // Sheet assumed for addresses given without a "Sheet!" prefix
    private String defaultSheet = ReferenceCodec.DEFAULT_SHEET;

    // Largest number of cells one range reference may expand to
    private int maxRangeCells = FormulaEngine.DEFAULT_MAX_RANGE_CELLS;

    public String getDefaultSheet() {
        return defaultSheet;
    }

    public void setDefaultSheet(String defaultSheet) {
        this.defaultSheet = defaultSheet;
    }

    public int getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }
}
