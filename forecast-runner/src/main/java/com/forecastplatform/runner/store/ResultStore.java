package com.forecastplatform.runner.store;

import com.forecastplatform.runner.model.ForecastRecord;

/** Blocking persistence of forecast records; callers schedule it off the event loop. */
public interface ResultStore {

    boolean exists(ResultKey key);

    void save(ResultKey key, ForecastRecord record);
}
