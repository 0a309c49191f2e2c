package com.example.clipflow.repository;

import com.example.clipflow.domain.PipelineSetting;
import org.springframework.data.repository.CrudRepository;

public interface PipelineSettingRepository extends CrudRepository<PipelineSetting, String> {
}
