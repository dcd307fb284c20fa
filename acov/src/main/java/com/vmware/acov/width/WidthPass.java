/*
 * Copyright (c) 2021 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 *
 */

package com.vmware.acov.width;

import com.vmware.acov.AcovException;
import com.vmware.acov.ir.*;
import com.vmware.acov.util.Linq;
import com.vmware.acov.util.Utilities;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Width checking of a whole script.  Every record gets a width, every block
 * guard must be a single bit, and every cover statement must be
 * compatible with the width of the record it covers.
 *
 * <p>All the errors of independent parts of the script are reported
 * together; later stages only run when the stages they depend on succeed.
 */
public class WidthPass {
    private static final Logger logger = Logger.getLogger(WidthPass.class.getName());
    /**
     * Widest record that can be covered without an explicit cover list.
     */
    public static final int maxImplicitCoverWidth = 16;

    private final ConstantFolder folder;

    public WidthPass() {
        this.folder = new ConstantFolder();
    }

    public ErrorsOr<WidthScript> run(Script script) {
        ErrorsOr<WidthScript> result = this.readModules(script.modules).flatMap(
                modules -> this.checkStatements(modules, script.statements).map(
                        ignored -> new WidthScript(modules, script.statements)));
        if (result.isBad())
            logger.info("Width checking found " + result.getErrors().size() + " error(s)");
        return result;
    }

    ErrorsOr<SymbolTable<WidthModule>> readModules(SymbolTable<AcovModule> modules) {
        List<ErrorsOr<WidthModule>> checked = new ArrayList<ErrorsOr<WidthModule>>();
        for (Symbol s: modules)
            checked.add(this.readModule(s, modules.get(s)));
        return ErrorsOr.all(checked).map(
                list -> modules.mapWithSymbol((s, m) -> list.get(s.index)));
    }

    ErrorsOr<WidthModule> readModule(Symbol name, AcovModule module) {
        logger.fine(() -> "Checking widths in module " + name);
        WidthChecker checker = new WidthChecker(module.signals, this.folder);
        Map<Symbol, AcovRecord> writers = new HashMap<Symbol, AcovRecord>();
        Map<Symbol, Integer> widths = new HashMap<Symbol, Integer>();
        List<ErrorsOr<Void>> blocks = Linq.map(module.blocks, b -> this.takeBlock(checker, module, writers, widths, b));
        return ErrorsOr.all(blocks).map(ignored -> {
            SymbolTable<Integer> recordWidths = module.records.mapWithSymbol((s, decl) -> {
                Integer width = widths.get(s);
                if (width == null)
                    decl.error("Record " + s + " is never recorded");
                return width;
            });
            List<Group> groups = Linq.map(module.groups, g -> makeGroup(recordWidths, g));
            return new WidthModule(name.name, module, recordWidths, groups);
        });
    }

    ErrorsOr<Void> takeBlock(WidthChecker checker, AcovModule module, Map<Symbol, AcovRecord> writers,
                             Map<Symbol, Integer> widths, Block block) {
        ErrorsOr<Void> guard = block.guard == null ? ErrorsOr.ok() : this.checkGuard(checker, block.guard);
        List<ErrorsOr<Void>> records = Linq.map(block.records, r -> this.takeRecord(checker, module, writers, widths, r));
        return ErrorsOr.both(guard, ErrorsOr.all(records)).map(ignored -> null);
    }

    ErrorsOr<Void> checkGuard(WidthChecker checker, AcovExpression guard) {
        return checker.width(guard).flatMap(w -> {
            if (w != 1)
                return ErrorsOr.bad(guard.getRange(),
                        "Block is guarded by expression with width " + w + ", not 1.");
            return ErrorsOr.ok();
        });
    }

    /**
     * Infer the width of a recorded expression.  The destination is claimed
     * before the width is inferred, so a second writer is caught even when
     * the first one has errors.
     */
    ErrorsOr<Void> takeRecord(WidthChecker checker, AcovModule module, Map<Symbol, AcovRecord> writers,
                              Map<Symbol, Integer> widths, AcovRecord record) {
        if (!module.records.contains(record.destination))
            record.error("Record destination " + record.destination + " is not a declared record");
        if (!Utilities.putNew(writers, record.destination, record))
            record.error("Record " + record.destination + " is recorded more than once");
        return checker.width(record.expression).map(w -> {
            widths.put(record.destination, w);
            return null;
        });
    }

    static Group makeGroup(SymbolTable<Integer> recordWidths, GroupDeclaration declaration) {
        long width = 0;
        for (Symbol r: declaration.getRecords()) {
            if (!recordWidths.contains(r))
                declaration.error("Group " + declaration.name + " refers to unknown record " + r);
            width += recordWidths.get(r);
        }
        if (width > Integer.MAX_VALUE)
            declaration.error("Group " + declaration.name + " is too wide");
        return new Group(declaration, (int)width);
    }

    ErrorsOr<Void> checkStatements(SymbolTable<WidthModule> modules, List<TopLevelStatement> statements) {
        List<ErrorsOr<Void>> checked = Linq.map(statements, s -> this.checkStatement(modules, s));
        return ErrorsOr.all(checked).map(ignored -> null);
    }

    ErrorsOr<Void> checkStatement(SymbolTable<WidthModule> modules, TopLevelStatement statement) {
        if (statement.is(CoverStatement.class))
            return checkCover(modules, statement.to(CoverStatement.class));
        if (statement.is(CrossStatement.class))
            return ErrorsOr.ok();
        throw new AcovException("Unexpected statement " + statement, statement.getRange());
    }

    static ErrorsOr<Void> checkCover(SymbolTable<WidthModule> modules, CoverStatement cover) {
        DottedSymbol target = cover.target;
        int width = modules.get(target.module).getRecordWidth(target.record);
        if (cover.coverList == null) {
            if (width > maxImplicitCoverWidth)
                return ErrorsOr.bad(target.getRange(), "Symbol has width more than " +
                        maxImplicitCoverWidth + " and no cover list.");
            return ErrorsOr.ok();
        }
        List<ErrorsOr<Void>> entries = Linq.map(cover.coverList.values, v -> checkCoverEntry(width, v));
        return ErrorsOr.all(entries).map(ignored -> null);
    }

    static ErrorsOr<Void> checkCoverEntry(int width, AcovEInt entry) {
        if (Utilities.fitsInBits(entry.value.value, width))
            return ErrorsOr.ok();
        return ErrorsOr.bad(entry.getRange(), "Cover list has entry of " + entry.value.value +
                ", but the cover expression has width " + width + ".");
    }
}
