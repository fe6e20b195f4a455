package org.dxworks.apislice.model;

import java.util.ArrayList;
import java.util.List;

public class ImportInfo {
    /** Imported name for namespace and side-effect imports, which bind no single symbol. */
    public static final String NAMESPACE = "*";
    /** Origin of a bare specifier that resolves to neither a local file nor a local package. */
    public static final String EXTERNAL_ORIGIN = "<builtin_or_external>";

    /** Name looked up in the origin file's declarations. */
    public String importedName;
    /** Name the binding is referenced by in the importing file; {@code null} for side-effect imports. */
    public String localName;
    public String source;
    /** Absolute path, {@link #EXTERNAL_ORIGIN}, or {@code null} when a relative specifier was not found. */
    public String origin;
    public int line;
    public boolean originExists;
    public List<Integer> usageLines = new ArrayList<>();

    public boolean isUsedWithin(int fromLine, int toLine) {
        for (int usage : usageLines) {
            if (fromLine <= usage && usage <= toLine) {
                return true;
            }
        }
        return false;
    }
}
