package io.github.jaggr.driver;

import io.github.jaggr.table.Table;

public interface BatchSource {
    /**
     * @return the next batch, null at the end of input
     */
    Table next();
}
