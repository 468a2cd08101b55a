package com.nevis.reports.service;

import com.nevis.reports.model.Folder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface FolderIndexer {

    List<Folder> listFolders(Optional<Instant> cutoff);
}
