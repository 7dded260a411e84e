package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.EngineProperties;
import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.engine.FunctionCatalog;
import com.spreadsheet.formula.engine.ReferenceCodec;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import com.spreadsheet.formula.exceptions.WorkbookNotFoundException;
import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.CellEdit;
import com.spreadsheet.formula.models.FunctionInfo;
import com.spreadsheet.formula.models.GraphSnapshot;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.models.WorkbookDocument;
import com.spreadsheet.formula.models.WorkbookSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Main business logic for storing workbooks, applying cell edits,
 * reading computed values and triggering recalculation.
 *
 * Every workbook owns one FormulaEngine. Calls that change content or
 * evaluate cells (evaluation fills the result cache) take the workbook's
 * write lock; pure graph and raw-content queries take the read lock.
 */
@Service
public class WorkbookService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookService.class);

    // All workbooks live here in memory, keyed by name
    private final Map<String, Workbook> workbooks = new ConcurrentHashMap<>();

    private final EngineProperties properties;

    public WorkbookService() {
        this(new EngineProperties());
    }

    @Autowired
    public WorkbookService(EngineProperties properties) {
        this.properties = properties;
    }

    // ----------------------------------------------------------------
    // Documents
    // ----------------------------------------------------------------

    /**
     * Creates or replaces the named workbook from its raw contents.
     * The contents are loaded into a fresh engine first, so a document
     * containing a circular reference is rejected and the previous
     * workbook (if any) stays untouched.
     *
     * @return true if the workbook was created, false if it replaced an existing one
     */
    public boolean saveWorkbook(WorkbookDocument document) {
        if (document == null || document.getName() == null || document.getName().isBlank()
                || document.getWorksheets() == null) {
            throw new IllegalArgumentException("Workbook name and data are required.");
        }
        String name = document.getName().trim();

        FormulaEngine engine = newEngine();
        for (Map.Entry<String, Map<String, String>> sheet : document.getWorksheets().entrySet()) {
            if (sheet.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, String> cell : sheet.getValue().entrySet()) {
                if (cell.getValue() != null) {
                    engine.setContent(resolveAddress(sheet.getKey(), cell.getKey()), cell.getValue());
                }
            }
        }

        Workbook previous = workbooks.get(name);
        Instant createdAt = previous != null ? previous.getCreatedAt() : Instant.now();
        workbooks.put(name, new Workbook(name, engine, createdAt));
        logger.info("{} workbook '{}' with {} cell(s)", previous == null ? "Created" : "Replaced",
                name, engine.rawContents().size());
        return previous == null;
    }

    /**
     * Retrieves a Workbook by name. Throws if not found.
     */
    public Workbook getWorkbook(String name) {
        Workbook workbook = workbooks.get(name);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + name);
        }
        return workbook;
    }

    /**
     * Raw contents of the workbook in its persistence shape.
     */
    public WorkbookDocument getDocument(String name) {
        Workbook workbook = getWorkbook(name);
        return read(workbook, () -> {
            Map<String, Map<String, String>> worksheets = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : workbook.getEngine().rawContents().entrySet()) {
                String address = entry.getKey();
                String sheet = ReferenceCodec.sheetOf(address);
                worksheets.computeIfAbsent(sheet, k -> new LinkedHashMap<>())
                        .put(address.substring(sheet.length() + 1), entry.getValue());
            }
            WorkbookDocument document = new WorkbookDocument(workbook.getName(), worksheets);
            document.setCreatedAt(workbook.getCreatedAt());
            document.setUpdatedAt(workbook.getUpdatedAt());
            return document;
        });
    }

    public List<WorkbookSummary> listWorkbooks() {
        return workbooks.values().stream()
                .sorted(Comparator.comparing(Workbook::getName))
                .map(w -> new WorkbookSummary(w.getName(), w.getCreatedAt(), w.getUpdatedAt()))
                .collect(Collectors.toList());
    }

    public void deleteWorkbook(String name) {
        if (workbooks.remove(name) == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + name);
        }
        logger.info("Deleted workbook '{}'", name);
    }

    // ----------------------------------------------------------------
    // Cells
    // ----------------------------------------------------------------

    /**
     * Sets a cell (literal or "=formula"), recalculates its dependents and
     * returns the cell's new display value.
     * A circular reference is rejected and leaves the workbook unchanged.
     */
    public Object setCell(String name, String sheet, String cell, String rawValue) {
        Workbook workbook = getWorkbook(name);
        String address = resolveAddress(sheet, cell);
        return write(workbook, () -> {
            FormulaEngine engine = workbook.getEngine();
            engine.setContent(address, rawValue);
            workbook.touch();
            engine.recalculate(List.of(address));
            return engine.evaluate(address).getDisplayValue();
        });
    }

    /**
     * Applies a batch of edits in order (e.g. relayed from other users), then
     * recalculates everything they affect. Returns the recalculation order.
     * The first rejected edit (circular reference, invalid cell) stops the batch;
     * edits before it stay applied and are recalculated.
     */
    public List<String> applyEdits(String name, List<CellEdit> edits) {
        Workbook workbook = getWorkbook(name);
        return write(workbook, () -> {
            FormulaEngine engine = workbook.getEngine();
            Set<String> changed = new LinkedHashSet<>();
            try {
                for (CellEdit edit : edits) {
                    String sheet = edit.getSheet() != null ? edit.getSheet() : properties.getDefaultSheet();
                    changed.add(engine.updateCell(edit.getColumn(), edit.getRow(), edit.getRawValue(), sheet));
                }
            } catch (RuntimeException e) {
                // Edits before the failing one stay applied and must be consistent
                logger.warn("Edit batch on '{}' stopped after {} edit(s): {}", name, changed.size(), e.getMessage());
                engine.recalculate(changed);
                workbook.touch();
                throw e;
            }
            workbook.touch();
            return engine.recalculate(changed);
        });
    }

    public void clearCell(String name, String sheet, String cell) {
        Workbook workbook = getWorkbook(name);
        String address = resolveAddress(sheet, cell);
        write(workbook, () -> {
            workbook.getEngine().clearContent(address);
            workbook.touch();
            return workbook.getEngine().recalculate(List.of(address));
        });
    }

    public Object getCellValue(String name, String sheet, String cell) {
        Workbook workbook = getWorkbook(name);
        String address = resolveAddress(sheet, cell);
        return write(workbook, () -> workbook.getEngine().evaluate(address).getDisplayValue());
    }

    /**
     * Display values of every cell that has content, keyed by canonical address.
     */
    public Map<String, Object> getValues(String name) {
        Workbook workbook = getWorkbook(name);
        return write(workbook, () -> {
            FormulaEngine engine = workbook.getEngine();
            Map<String, Object> values = new LinkedHashMap<>();
            for (String address : engine.rawContents().keySet()) {
                values.put(address, engine.evaluate(address).getDisplayValue());
            }
            return values;
        });
    }

    public Set<String> getDependents(String name, String sheet, String cell) {
        Workbook workbook = getWorkbook(name);
        String address = resolveAddress(sheet, cell);
        return read(workbook, () -> workbook.getEngine().getDependents(address));
    }

    public Set<String> getDependencies(String name, String sheet, String cell) {
        Workbook workbook = getWorkbook(name);
        String address = resolveAddress(sheet, cell);
        return read(workbook, () -> workbook.getEngine().getDependencies(address));
    }

    /**
     * Bulk recalculation trigger for cells changed elsewhere.
     */
    public List<String> recalculate(String name, Collection<String> changedAddresses) {
        Workbook workbook = getWorkbook(name);
        return write(workbook, () -> workbook.getEngine().recalculate(new ArrayList<>(changedAddresses)));
    }

    public GraphSnapshot getDependencyGraph(String name) {
        Workbook workbook = getWorkbook(name);
        return read(workbook, () -> workbook.getEngine().exportDependencyGraph());
    }

    // ----------------------------------------------------------------
    // Functions
    // ----------------------------------------------------------------

    /**
     * Built-in functions matching what an editor has typed so far.
     */
    public List<FunctionInfo> suggestFunctions(String prefix, Integer limit) {
        int max = limit != null ? limit : FunctionCatalog.DEFAULT_MAX_SUGGESTIONS;
        if (max < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got " + max);
        }
        return FunctionCatalog.suggest(prefix, max);
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private FormulaEngine newEngine() {
        return new FormulaEngine(properties.getDefaultSheet(), properties.getMaxRangeCells());
    }

    /**
     * Canonical address of an A1 cell on a sheet; a "Sheet!" prefix on the cell wins.
     */
    private String resolveAddress(String sheet, String cell) {
        String sheetName = sheet != null ? sheet : properties.getDefaultSheet();
        return ReferenceCodec.parse(cell == null ? null : cell.trim(), sheetName)
                .map(CellCoordinate::toAddress)
                .orElseThrow(() -> new InvalidReferenceException("Not a cell reference: " + cell));
    }

    private <T> T read(Workbook workbook, Supplier<T> action) {
        return locked(workbook.getLock().readLock(), action);
    }

    private <T> T write(Workbook workbook, Supplier<T> action) {
        return locked(workbook.getLock().writeLock(), action);
    }

    private static <T> T locked(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
