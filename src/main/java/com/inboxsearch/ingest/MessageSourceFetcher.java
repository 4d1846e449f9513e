package com.inboxsearch.ingest;

import java.io.IOException;

import com.inboxsearch.identity.Principal;

/**
 * Pulls messages for one owner from an external source. Calling it again with the same cursor must
 * return the same page.
 */
public interface MessageSourceFetcher {
    FetchPage fetch(Principal owner, String source, String cursor) throws IOException;
}
