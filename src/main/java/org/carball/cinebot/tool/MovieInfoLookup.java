package org.carball.cinebot.tool;

import java.util.List;

/**
 * Online movie information service.
 *
 * @throws ExternalLookupException from every method when the service fails or finds nothing
 */
public interface MovieInfoLookup {

    OmdbMovie lookup(String title, boolean fullPlot);

    List<OmdbSearchHit> search(String keyword);
}
