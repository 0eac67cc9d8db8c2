package com.nowa.archive.tag;

import org.springframework.stereotype.Component;

import java.util.List;

/** 非互動預設：建議直接套用，之後再透過 CSV review */
@Component
public class AutoAcceptTagPrompt implements TagPrompt {

    @Override
    public List<String> confirm(String folderKey, List<String> suggested, int fileCount) {
        return suggested == null ? List.of() : List.copyOf(suggested);
    }
}
