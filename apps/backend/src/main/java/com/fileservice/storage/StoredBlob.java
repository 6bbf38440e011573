package com.fileservice.storage;

import java.time.Instant;

/** list() 返回的条目：key + 最后修改时间（给孤儿清理判断宽限期用）。 */
public record StoredBlob(String key, Instant lastModified) {}
