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

package com.vmware.acov.ir;

import com.vmware.acov.AcovException;

import javax.annotation.Nullable;
import java.util.*;
import java.util.function.BiFunction;

/**
 * An ordered arena of declarations.  Symbols are handed out in declaration
 * order and never removed, so the table can be shared freely once built.
 */
public class SymbolTable<T> implements Iterable<Symbol> {
    private final List<Symbol> symbols;
    private final List<T> data;
    private final Map<String, Symbol> byName;

    public SymbolTable() {
        this.symbols = new ArrayList<Symbol>();
        this.data = new ArrayList<T>();
        this.byName = new HashMap<String, Symbol>();
    }

    /**
     * Declare a new symbol.
     * @param name   Symbol name; must be fresh in this table.
     * @param value  Data attached to the symbol.
     */
    public Symbol add(String name, T value) {
        if (this.byName.containsKey(name))
            throw new AcovException("Symbol " + name + " declared twice");
        Symbol symbol = new Symbol(this.symbols.size(), name);
        this.symbols.add(symbol);
        this.data.add(Objects.requireNonNull(value));
        this.byName.put(name, symbol);
        return symbol;
    }

    public boolean contains(Symbol symbol) {
        return symbol.index >= 0 && symbol.index < this.symbols.size() &&
                this.symbols.get(symbol.index).equals(symbol);
    }

    public T get(Symbol symbol) {
        if (!this.contains(symbol))
            throw new AcovException("Symbol " + symbol + " is not in the table");
        return this.data.get(symbol.index);
    }

    @Nullable
    public Symbol lookup(String name) {
        return this.byName.get(name);
    }

    public int size() {
        return this.symbols.size();
    }

    public List<Symbol> symbols() {
        return Collections.unmodifiableList(this.symbols);
    }

    public List<T> values() {
        return Collections.unmodifiableList(this.data);
    }

    /**
     * Build a table with the same symbols and new data.
     */
    public <S> SymbolTable<S> mapWithSymbol(BiFunction<Symbol, T, S> function) {
        SymbolTable<S> result = new SymbolTable<S>();
        for (Symbol s: this.symbols) {
            Symbol added = result.add(s.name, function.apply(s, this.data.get(s.index)));
            assert added.equals(s);
        }
        return result;
    }

    @Override
    public Iterator<Symbol> iterator() {
        return this.symbols().iterator();
    }
}
