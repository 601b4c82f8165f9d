package com.delta.harvester.crawl.checkpoint;

import java.nio.file.Path;

public record CheckpointFiles(Path csvFile, Path jsonFile, int recordCount) {}
