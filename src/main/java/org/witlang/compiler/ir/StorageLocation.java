package org.witlang.compiler.ir;

/**
 * Where a variable lives once its declaration has been emitted. A global variable lives at
 * {@code [label]}; a local variable lives at {@code [rbp-offset]}.
 *
 * @param global {@code true} for data-section storage, {@code false} for frame storage.
 * @param label The data label of a global variable; empty for locals.
 * @param offset The positive distance below the frame base for locals; 0 for globals.
 * @param size The size of the storage in bytes.
 */
public record StorageLocation(boolean global, String label, int offset, int size) {

    public static StorageLocation global(String label, int size) {
        return new StorageLocation(true, label, 0, size);
    }

    public static StorageLocation local(int offset, int size) {
        return new StorageLocation(false, "", offset, size);
    }
}
