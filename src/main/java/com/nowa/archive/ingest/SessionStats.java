package com.nowa.archive.ingest;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 單次匯入的計數器；只有匯入的 thread 會寫 */
@Getter
public class SessionStats {

    private int imported;
    private int duplicates;
    private int tagsAdded;
    private int errors;
    private final List<String> errorDetails = new ArrayList<>();

    public void recordImported() { imported++; }

    public void recordDuplicate() { duplicates++; }

    public void addTags(int n) { tagsAdded += n; }

    public void recordError(String detail) {
        errors++;
        errorDetails.add(detail);
    }

    public List<String> getErrorDetails() {
        return Collections.unmodifiableList(errorDetails);
    }

    public String summary() {
        return String.format("Imported: %d, Duplicates: %d, Tags added: %d, Errors: %d",
                imported, duplicates, tagsAdded, errors);
    }
}
