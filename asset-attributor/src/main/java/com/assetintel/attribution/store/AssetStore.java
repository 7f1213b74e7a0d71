package com.assetintel.attribution.store;

import com.assetintel.attribution.model.Asset;
import com.assetintel.attribution.model.AssetCategory;
import com.assetintel.attribution.model.AttributionIssue;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.model.SurveyNode;
import com.assetintel.attribution.model.Zone;

import java.util.List;
import java.util.Set;

/**
 * The spatial data store as seen by the attribution engine.
 *
 * Every write touches a single asset row and is applied atomically. Writes
 * never overwrite a non-null identifier field. Infrastructure failures surface
 * as {@link com.assetintel.attribution.exception.StoreUnavailableException}.
 */
public interface AssetStore {

    void ensureSchema();

    /**
     * Assets of one category still waiting for a facility id and not last
     * edited by {@code authoritativeEditor}, ascending by id.
     */
    List<Asset> findCandidates(AssetCategory category, String authoritativeEditor);

    /** All point assets of the given categories, attributed or not. */
    List<Asset> findPoints(Set<AssetCategory> categories);

    List<Zone> findZones();

    /**
     * Facility ids of one category that contain {@code fragment}. This may
     * include ids of other zones whose code embeds the fragment; callers
     * filter by position.
     */
    List<String> findFacilityIdsContaining(AssetCategory category, String fragment);

    List<SurveyNode> findSurveyNodes();

    /** Coordinates, elevation and spatial tokens; only null columns are filled. */
    void updateDerivedFields(Asset asset);

    /** FROMMH / TOMH; only null columns are filled. */
    void updateEndpoints(long assetId, String endpointFrom, String endpointTo);

    /**
     * Sets the facility id of an asset that has none.
     *
     * @throws com.assetintel.attribution.exception.ZoneAllocationConflictException
     *         if the id is already taken in the category or the row was attributed meanwhile
     */
    void assignFacilityId(Asset asset, String facilityId);

    void recordRun(AttributionRun run);

    void recordIssues(List<AttributionIssue> issues);
}
