package com.nowa.archive.tag;

import java.util.List;

/**
 * tag 確認介面。✅ 每個 session 每個來源資料夾最多問一次
 */
public interface TagPrompt {

    /**
     * @param folderKey   "<root label>/<relative folder>"，見 {@link FolderKeys}
     * @param suggested   從資料夾路徑取出的 tag
     * @param fileCount   該資料夾找到的檔案數
     * @return 套用到該資料夾每個檔案的 tag
     */
    List<String> confirm(String folderKey, List<String> suggested, int fileCount);
}
