package com.fileservice.mapper;

import com.fileservice.file.domain.FileRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.UUID;

/** SQL 见 resources/mapper/FileRecordMapper.xml */
@Mapper
public interface FileRecordMapper {

    int insert(FileRecord file);

    FileRecord selectById(@Param("id") UUID id);

    FileRecord selectByChecksum(@Param("checksum") String checksum);

    List<FileRecord> selectRecent(@Param("limit") int limit);

    int deleteById(@Param("id") UUID id);

    /** 所有被记录引用的 key（file_path 与 thumbnail_path），供孤儿清理使用 */
    List<String> selectReferencedKeys();
}
