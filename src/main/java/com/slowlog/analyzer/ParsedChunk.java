package com.slowlog.analyzer;

import java.util.List;

/**
 * A slice of work results tagged with its position so that chunks finishing out of order can be reassembled.
 */
public class ParsedChunk<T> {

    private final int index;
    private final List<T> items;

    public ParsedChunk(int index, List<T> items) {
        this.index = index;
        this.items = items;
    }

    public int getIndex() {
        return index;
    }

    public List<T> getItems() {
        return items;
    }
}
