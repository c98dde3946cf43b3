package com.uitgo.proximity.index;

import com.uitgo.proximity.model.Cell;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.SearchHit;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Hierarchical hexagonal partition of the sphere with a cell → ids membership index.
 * Membership is only maintained once the index has been built.
 */
public interface CellIndex {
    
    /**
     * Resolution the membership index is kept at
     */
    int getResolution();
    
    /**
     * Whether {@link #build(Collection)} has run and {@link #drop()} has not since
     */
    boolean isBuilt();
    
    /**
     * Replace all membership with the given points and mark the index built
     */
    void build(Collection<DriverPoint> points);
    
    /**
     * Forget all membership and mark the index unbuilt
     */
    void drop();
    
    /**
     * Cell containing the coordinate at the index resolution. Pure and deterministic.
     */
    Cell cellFor(double longitude, double latitude);
    
    /**
     * The given cell plus enough rings of neighbors to cover every point within {@code radiusKm}
     * of any location inside that cell
     */
    Set<Cell> neighborCells(Cell cell, double radiusKm);
    
    /**
     * Move {@code id} into the cell of the coordinate and out of its previous cell in one call
     *
     * @return the cell the id now belongs to
     */
    Cell place(String id, double longitude, double latitude);
    
    /**
     * First half of a move: add {@code id} to {@code cell} and record it as the id's cell.
     * The id stays in its previous cell until {@link #leave(String, Cell)} is called.
     *
     * @return the cell the id was assigned to before, if any
     */
    Optional<Cell> join(String id, Cell cell);
    
    /**
     * Second half of a move: drop {@code id} from {@code cell} unless that is still its assigned cell
     */
    void leave(String id, Cell cell);
    
    /**
     * Run a membership change that {@link #query} must never observe half done.
     * Candidate collection and the change do not overlap, so a query finds a moving id in the
     * cell it held before the change or in the one it holds after.
     */
    <T> T exclusively(Supplier<T> change);
    
    /**
     * Remove {@code id} from whichever cell holds it
     */
    void unassign(String id);
    
    Optional<Cell> cellOf(String id);
    
    /**
     * Ids currently in the cell
     */
    Set<String> members(Cell cell);
    
    /**
     * Number of non-empty cells
     */
    long cellCount();
    
    /**
     * Radius query bounded by the candidate set of the neighboring cells
     *
     * @throws com.uitgo.proximity.exception.IndexUnavailableException if the index has not been built
     */
    List<SearchHit> query(double longitude, double latitude, double radiusKm, int limit);
}
