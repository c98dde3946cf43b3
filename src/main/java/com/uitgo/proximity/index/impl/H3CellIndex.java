package com.uitgo.proximity.index.impl;

import com.uitgo.proximity.config.ProximityProperties;
import com.uitgo.proximity.exception.IndexUnavailableException;
import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.index.CellIndex;
import com.uitgo.proximity.model.Cell;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.SearchHit;
import com.uitgo.proximity.repository.PointStore;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * CellIndex over the Uber H3 grid.
 * Coordinates stay in the PointStore; this class only owns the cell membership sets.
 */
@Component
@Slf4j
public class H3CellIndex implements CellIndex {
    
    // Neighbor cells can be slightly smaller or larger than the center cell
    private static final double EDGE_SHRINK_FACTOR = 0.9;
    private static final double EDGE_GROWTH_FACTOR = 1.1;
    
    private final H3Core h3;
    private final PointStore pointStore;
    private final int resolution;
    
    // Swapped as a whole by build(), mutated in place by writers afterwards
    private volatile Map<Long, Set<String>> membership = new ConcurrentHashMap<>();
    private volatile Map<String, Long> assignments = new ConcurrentHashMap<>();
    private volatile boolean built;
    
    // Shared: candidate collection. Exclusive: moves, build and drop.
    private final ReentrantReadWriteLock membershipLock = new ReentrantReadWriteLock();
    
    public H3CellIndex(H3Core h3, PointStore pointStore, ProximityProperties properties) {
        int configured = properties.getIndex().getResolution();
        if (configured < 0 || configured > 15) {
            throw new IllegalArgumentException("H3 resolution must be 0-15, got: " + configured);
        }
        this.h3 = h3;
        this.pointStore = pointStore;
        this.resolution = configured;
        log.info("H3 cell index configured at resolution {} (avg edge {} km)",
                resolution, h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.km));
    }
    
    @Override
    public int getResolution() {
        return resolution;
    }
    
    @Override
    public boolean isBuilt() {
        return built;
    }
    
    @Override
    public void build(Collection<DriverPoint> points) {
        log.info("Building H3 cell index at resolution {} from {} points", resolution, points.size());
        long startTime = System.currentTimeMillis();
        
        Map<Long, Set<String>> freshMembership = new ConcurrentHashMap<>();
        Map<String, Long> freshAssignments = new ConcurrentHashMap<>();
        for (DriverPoint point : points) {
            long cellId = cellFor(point.getLongitude(), point.getLatitude()).getCellId();
            Long previous = freshAssignments.put(point.getId(), cellId);
            if (previous != null && previous != cellId) {
                Set<String> members = freshMembership.get(previous);
                members.remove(point.getId());
                if (members.isEmpty()) {
                    freshMembership.remove(previous);
                }
            }
            freshMembership.computeIfAbsent(cellId, k -> ConcurrentHashMap.newKeySet()).add(point.getId());
        }
        
        exclusively(() -> {
            membership = freshMembership;
            assignments = freshAssignments;
            built = true;
            return null;
        });
        
        long endTime = System.currentTimeMillis();
        log.info("Completed H3 cell index build: {} points in {} cells in {}ms", 
                freshAssignments.size(), freshMembership.size(), (endTime - startTime));
    }
    
    @Override
    public void drop() {
        exclusively(() -> {
            built = false;
            membership = new ConcurrentHashMap<>();
            assignments = new ConcurrentHashMap<>();
            return null;
        });
        log.info("Dropped H3 cell index at resolution {}", resolution);
    }
    
    @Override
    public Cell cellFor(double longitude, double latitude) {
        GeoDistance.requireValid(longitude, latitude);
        return new Cell(h3.latLngToCell(latitude, longitude, resolution), resolution);
    }
    
    @Override
    public Set<Cell> neighborCells(Cell cell, double radiusKm) {
        int rings = ringsFor(cell.getCellId(), radiusKm);
        List<Long> disk = h3.gridDisk(cell.getCellId(), rings);
        
        Set<Cell> cells = new HashSet<>(disk.size() * 2);
        for (Long cellId : disk) {
            cells.add(new Cell(cellId, resolution));
        }
        return cells;
    }
    
    /**
     * Ring count k such that the k-disk around the cell covers a circle of {@code radiusKm}
     * centred anywhere inside it. Cell centers k rings apart are at least {@code 1.5 * k * edge}
     * away from each other, and both the query center and a matching point may sit up to one
     * edge (the circumradius) off their own cell center.
     */
    int ringsFor(long cellId, double radiusKm) {
        double minEdgeKm = Double.MAX_VALUE;
        double maxEdgeKm = 0.0;
        for (Long edge : h3.originToDirectedEdges(cellId)) {
            double length = h3.edgeLength(edge, LengthUnit.km);
            minEdgeKm = Math.min(minEdgeKm, length);
            maxEdgeKm = Math.max(maxEdgeKm, length);
        }
        double reachKm = radiusKm + 2.0 * maxEdgeKm * EDGE_GROWTH_FACTOR;
        double ringStepKm = 1.5 * minEdgeKm * EDGE_SHRINK_FACTOR;
        return Math.max(1, (int) Math.ceil(reachKm / ringStepKm));
    }
    
    /**
     * Number of cells in a k-disk, as a double so huge ring counts cannot overflow
     */
    static double diskSize(int rings) {
        return 3.0 * rings * (rings + 1.0) + 1.0;
    }
    
    @Override
    public Cell place(String id, double longitude, double latitude) {
        Cell cell = cellFor(longitude, latitude);
        return exclusively(() -> {
            join(id, cell).ifPresent(previous -> leave(id, previous));
            return cell;
        });
    }
    
    @Override
    public <T> T exclusively(Supplier<T> change) {
        membershipLock.writeLock().lock();
        try {
            return change.get();
        } finally {
            membershipLock.writeLock().unlock();
        }
    }
    
    @Override
    public Optional<Cell> join(String id, Cell cell) {
        long cellId = cell.getCellId();
        membership.compute(cellId, (k, members) -> {
            Set<String> set = members != null ? members : ConcurrentHashMap.newKeySet();
            set.add(id);
            return set;
        });
        Long previous = assignments.put(id, cellId);
        return previous != null ? Optional.of(new Cell(previous, resolution)) : Optional.empty();
    }
    
    @Override
    public void leave(String id, Cell cell) {
        long cellId = cell.getCellId();
        Long current = assignments.get(id);
        if (current != null && current == cellId) {
            return;
        }
        removeMember(cellId, id);
    }
    
    @Override
    public void unassign(String id) {
        Long previous = assignments.remove(id);
        if (previous != null) {
            removeMember(previous, id);
        }
    }
    
    private void removeMember(long cellId, String id) {
        membership.computeIfPresent(cellId, (k, members) -> {
            members.remove(id);
            return members.isEmpty() ? null : members;
        });
    }
    
    @Override
    public Optional<Cell> cellOf(String id) {
        Long cellId = assignments.get(id);
        return cellId != null ? Optional.of(new Cell(cellId, resolution)) : Optional.empty();
    }
    
    @Override
    public Set<String> members(Cell cell) {
        Set<String> members = membership.get(cell.getCellId());
        return members != null ? Collections.unmodifiableSet(new HashSet<>(members)) : Collections.emptySet();
    }
    
    @Override
    public long cellCount() {
        return membership.size();
    }
    
    @Override
    public List<SearchHit> query(double longitude, double latitude, double radiusKm, int limit) {
        if (!built) {
            throw new IndexUnavailableException(resolution);
        }
        if (limit <= 0) {
            return Collections.emptyList();
        }
        
        Cell home = cellFor(longitude, latitude);
        int rings = ringsFor(home.getCellId(), radiusKm);
        
        Set<String> candidates = new HashSet<>();
        long cellsVisited;
        membershipLock.readLock().lock();
        try {
            Map<Long, Set<String>> cells = membership;
            if (diskSize(rings) > cells.size()) {
                // Disk larger than the occupied cells: every member is a candidate
                for (Set<String> members : cells.values()) {
                    candidates.addAll(members);
                }
                cellsVisited = cells.size();
            } else {
                List<Long> disk = h3.gridDisk(home.getCellId(), rings);
                for (Long cellId : disk) {
                    Set<String> members = cells.get(cellId);
                    if (members != null) {
                        candidates.addAll(members);
                    }
                }
                cellsVisited = disk.size();
            }
        } finally {
            membershipLock.readLock().unlock();
        }
        if (candidates.isEmpty()) {
            log.debug("Hierarchical query at ({},{}) r={}km: {} cells, no candidates", 
                    longitude, latitude, radiusKm, cellsVisited);
            return Collections.emptyList();
        }
        
        // A move joins, writes the store and leaves under the exclusive lock, so every
        // candidate's store position is its pre- or post-update one
        Map<String, DriverPoint> positions = pointStore.getAll(candidates);
        List<SearchHit> results = new ArrayList<>();
        for (DriverPoint point : positions.values()) {
            double distance = point.distanceKmTo(longitude, latitude);
            if (distance <= radiusKm) {
                results.add(new SearchHit(point.getId(), distance));
            }
        }
        results.sort(SearchHit.BY_DISTANCE);
        
        log.debug("Hierarchical query at ({},{}) r={}km: {} cells, {} candidates, {} in radius", 
                longitude, latitude, radiusKm, cellsVisited, candidates.size(), results.size());
        
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }
}
