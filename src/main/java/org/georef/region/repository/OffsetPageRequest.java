package org.georef.region.repository;

import java.util.Objects;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * {@link Pageable} addressed by a raw row offset instead of a page number.
 *
 * <p>List endpoints take {@code skip}/{@code limit}, and a skip that is not a multiple of the
 * limit cannot be expressed with {@link org.springframework.data.domain.PageRequest}. Rows are
 * ordered by id so that windows follow insertion order.
 */
public final class OffsetPageRequest implements Pageable {

  private static final Sort BY_ID = Sort.by("id").ascending();

  private final long offset;
  private final int limit;

  private OffsetPageRequest(long offset, int limit) {
    if (offset < 0) {
      throw new IllegalArgumentException("skip must not be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    this.offset = offset;
    this.limit = limit;
  }

  public static OffsetPageRequest of(long skip, int limit) {
    return new OffsetPageRequest(skip, limit);
  }

  @Override
  public int getPageNumber() {
    return (int) (offset / limit);
  }

  @Override
  public int getPageSize() {
    return limit;
  }

  @Override
  public long getOffset() {
    return offset;
  }

  @Override
  public Sort getSort() {
    return BY_ID;
  }

  @Override
  public Pageable next() {
    return new OffsetPageRequest(offset + limit, limit);
  }

  @Override
  public Pageable previousOrFirst() {
    return hasPrevious() ? new OffsetPageRequest(Math.max(0, offset - limit), limit) : first();
  }

  @Override
  public Pageable first() {
    return new OffsetPageRequest(0, limit);
  }

  @Override
  public Pageable withPage(int pageNumber) {
    return new OffsetPageRequest((long) pageNumber * limit, limit);
  }

  @Override
  public boolean hasPrevious() {
    return offset > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    var other = (OffsetPageRequest) o;
    return offset == other.offset && limit == other.limit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, limit);
  }

  @Override
  public String toString() {
    return "OffsetPageRequest[skip=" + offset + ", limit=" + limit + "]";
  }
}
