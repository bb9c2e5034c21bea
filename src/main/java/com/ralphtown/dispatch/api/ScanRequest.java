package com.ralphtown.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for POST /api/repos/scan.
 *
 * @param directories roots to search
 * @param depth       directory levels to descend; nullable, defaults to 2
 */
public record ScanRequest(List<String> directories, Integer depth) {}
