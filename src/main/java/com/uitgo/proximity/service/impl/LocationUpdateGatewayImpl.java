package com.uitgo.proximity.service.impl;

import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.index.CellIndex;
import com.uitgo.proximity.model.Cell;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.DriverStatus;
import com.uitgo.proximity.repository.PointStore;
import com.uitgo.proximity.service.LocationUpdateGateway;

import org.springframework.stereotype.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Implementation of LocationUpdateGateway keeping the point store and the cell index in step.
 * <p>
 * Writers for the same id are serialized on a striped lock and hold the shared side of
 * {@link #structureLock}; index build, drop and flush take its exclusive side. A move that
 * changes cell runs join, store write and leave inside {@link CellIndex#exclusively}, which
 * hierarchical queries never overlap while they collect candidates. Flat scans take no locks.
 */
@Service
public class LocationUpdateGatewayImpl implements LocationUpdateGateway {

    private static final Logger logger = LoggerFactory.getLogger(LocationUpdateGatewayImpl.class);

    private static final int LOCK_STRIPES = 64;

    private final PointStore pointStore;
    private final CellIndex cellIndex;

    private final Lock[] idLocks = new Lock[LOCK_STRIPES];
    private final ReentrantReadWriteLock structureLock = new ReentrantReadWriteLock();

    public LocationUpdateGatewayImpl(PointStore pointStore, CellIndex cellIndex) {
        this.pointStore = pointStore;
        this.cellIndex = cellIndex;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            idLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public Optional<Cell> reportLocation(String id, double longitude, double latitude) {
        requireId(id);
        GeoDistance.requireValid(longitude, latitude);
        DriverPoint point = DriverPoint.builder()
                .id(id)
                .longitude(longitude)
                .latitude(latitude)
                .updatedAt(System.currentTimeMillis())
                .build();

        Lock idLock = lockFor(id);
        structureLock.readLock().lock();
        idLock.lock();
        try {
            if (!cellIndex.isBuilt()) {
                pointStore.upsert(point);
                logger.debug("Stored {} at ({},{}) without cell index", id, longitude, latitude);
                return Optional.empty();
            }

            Cell cell = cellIndex.cellFor(longitude, latitude);
            if (cellIndex.cellOf(id).filter(cell::equals).isPresent()) {
                // Same cell: membership is untouched, only the position changes
                pointStore.upsert(point);
            } else {
                cellIndex.exclusively(() -> {
                    Optional<Cell> previous = cellIndex.join(id, cell);
                    try {
                        pointStore.upsert(point);
                    } catch (RuntimeException e) {
                        restore(id, cell, previous);
                        throw e;
                    }
                    previous.ifPresent(old -> cellIndex.leave(id, old));
                    return cell;
                });
            }

            logger.debug("Stored {} at ({},{}) in cell {}", id, longitude, latitude, cell.getAddress());
            return Optional.of(cell);
        } finally {
            idLock.unlock();
            structureLock.readLock().unlock();
        }
    }

    @Override
    public int bulkReport(Collection<DriverPoint> points) {
        Map<String, DriverPoint> latest = new LinkedHashMap<>();
        for (DriverPoint point : points) {
            requireId(point.getId());
            GeoDistance.requireValid(point.getLongitude(), point.getLatitude());
            latest.put(point.getId(), point);
        }
        if (latest.isEmpty()) {
            return 0;
        }

        logger.info("Starting bulk report of {} points", latest.size());
        long startTime = System.currentTimeMillis();

        structureLock.writeLock().lock();
        try {
            if (!cellIndex.isBuilt()) {
                pointStore.upsertAll(latest.values());
            } else {
                cellIndex.exclusively(() -> {
                    Map<String, Cell> joined = new LinkedHashMap<>();
                    Map<String, Optional<Cell>> previous = new HashMap<>();
                    for (DriverPoint point : latest.values()) {
                        Cell cell = cellIndex.cellFor(point.getLongitude(), point.getLatitude());
                        previous.put(point.getId(), cellIndex.join(point.getId(), cell));
                        joined.put(point.getId(), cell);
                    }
                    try {
                        pointStore.upsertAll(latest.values());
                    } catch (RuntimeException e) {
                        joined.forEach((id, cell) -> restore(id, cell, previous.get(id)));
                        throw e;
                    }
                    previous.forEach((id, old) -> old.ifPresent(cell -> cellIndex.leave(id, cell)));
                    return joined.size();
                });
            }
        } finally {
            structureLock.writeLock().unlock();
        }

        long endTime = System.currentTimeMillis();
        logger.info("Completed bulk report of {} points in {}ms", latest.size(), (endTime - startTime));
        return latest.size();
    }

    /**
     * Undo a join whose store write failed
     */
    private void restore(String id, Cell joined, Optional<Cell> previous) {
        if (previous.isPresent()) {
            cellIndex.join(id, previous.get());
            cellIndex.leave(id, joined);
        } else {
            cellIndex.unassign(id);
        }
    }

    @Override
    public boolean deregister(String id) {
        requireId(id);
        Lock idLock = lockFor(id);
        structureLock.readLock().lock();
        idLock.lock();
        try {
            boolean removed = pointStore.remove(id);
            cellIndex.unassign(id);
            logger.debug("Deregistered {} (present: {})", id, removed);
            return removed;
        } finally {
            idLock.unlock();
            structureLock.readLock().unlock();
        }
    }

    @Override
    public boolean updateStatus(String id, DriverStatus status) {
        requireId(id);
        if (status == null) {
            throw new IllegalArgumentException("Driver status must not be null");
        }
        if (!status.removesFromIndex()) {
            logger.debug("Driver {} is {}, waiting for next location report", id, status);
            return false;
        }
        return deregister(id);
    }

    @Override
    public Optional<DriverPoint> locate(String id) {
        requireId(id);
        return pointStore.get(id);
    }

    @Override
    public int buildIndex() {
        structureLock.writeLock().lock();
        try {
            List<DriverPoint> points = pointStore.snapshot();
            cellIndex.build(points);
            return points.size();
        } finally {
            structureLock.writeLock().unlock();
        }
    }

    @Override
    public void dropIndex() {
        structureLock.writeLock().lock();
        try {
            cellIndex.drop();
        } finally {
            structureLock.writeLock().unlock();
        }
    }

    @Override
    public void flush() {
        structureLock.writeLock().lock();
        try {
            pointStore.clear();
            if (cellIndex.isBuilt()) {
                cellIndex.build(Collections.emptyList());
            }
            logger.info("Flushed all points from {} store", pointStore.type());
        } finally {
            structureLock.writeLock().unlock();
        }
    }

    private Lock lockFor(String id) {
        return idLocks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private static void requireId(String id) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Driver id must not be blank");
        }
    }
}
